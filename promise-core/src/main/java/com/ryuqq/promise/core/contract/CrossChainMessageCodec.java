package com.ryuqq.promise.core.contract;

import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseSnapshot;
import com.ryuqq.promise.core.statemachine.PromiseStatus;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * {@link CrossChainMessage} ↔ {@link Payload} 변환.
 *
 * <p><strong>형식 (big-endian):</strong></p>
 * <pre>
 * [tag: byte]
 * 1 SetupRemotePromise   : remoteId(32) localProxyId(32) target(utf) selector(utf) registrant(utf) sourceChain(int64)
 * 2 ExecuteRemoteCallback: remoteId(32) value(int32 length + bytes)
 * 3 ShareResolvedPromise : id(32) status(byte: 1=RESOLVED, 2=REJECTED) value(int32 length + bytes)
 * </pre>
 *
 * <p>형식이 맞지 않거나 뒤에 남는 바이트가 있으면 {@link IllegalArgumentException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CrossChainMessageCodec {

    static final byte TAG_SETUP = 1;
    static final byte TAG_EXECUTE = 2;
    static final byte TAG_SHARE = 3;

    private static final byte STATUS_RESOLVED = 1;
    private static final byte STATUS_REJECTED = 2;

    private CrossChainMessageCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 메시지 인코딩.
     *
     * @param message 메시지
     * @return 인코딩된 Payload
     * @throws IllegalArgumentException message가 null인 경우
     */
    public static Payload encode(CrossChainMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            if (message instanceof SetupRemotePromise setup) {
                out.writeByte(TAG_SETUP);
                out.write(setup.remotePromiseId().toByteArray());
                out.write(setup.localProxyId().toByteArray());
                out.writeUTF(setup.target().getValue());
                out.writeUTF(setup.selector());
                out.writeUTF(setup.registrant().getValue());
                out.writeLong(setup.sourceChain().getValue());
            } else if (message instanceof ExecuteRemoteCallback execute) {
                out.writeByte(TAG_EXECUTE);
                out.write(execute.remotePromiseId().toByteArray());
                writePayload(out, execute.value());
            } else if (message instanceof ShareResolvedPromise share) {
                PromiseSnapshot snapshot = share.snapshot();
                out.writeByte(TAG_SHARE);
                out.write(snapshot.id().toByteArray());
                out.writeByte(snapshot.status() == PromiseStatus.RESOLVED ? STATUS_RESOLVED : STATUS_REJECTED);
                writePayload(out, snapshot.value());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode " + message.kind(), e);
        }
        return Payload.of(bytes.toByteArray());
    }

    /**
     * 메시지 디코딩.
     *
     * @param body 인코딩된 Payload
     * @return 메시지
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static CrossChainMessage decode(Payload body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        ByteArrayInputStream bytes = new ByteArrayInputStream(body.toByteArray());
        try (DataInputStream in = new DataInputStream(bytes)) {
            byte tag = in.readByte();
            CrossChainMessage message;
            switch (tag) {
                case TAG_SETUP:
                    message = new SetupRemotePromise(
                        readId(in),
                        readId(in),
                        Address.of(in.readUTF()),
                        in.readUTF(),
                        Address.of(in.readUTF()),
                        ChainId.of(in.readLong()));
                    break;
                case TAG_EXECUTE:
                    message = new ExecuteRemoteCallback(readId(in), readPayload(in));
                    break;
                case TAG_SHARE:
                    PromiseId id = readId(in);
                    PromiseStatus status = readStatus(in.readByte());
                    message = new ShareResolvedPromise(new PromiseSnapshot(id, status, readPayload(in)));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown message tag: " + tag);
            }
            if (bytes.available() > 0) {
                throw new IllegalArgumentException("Malformed message: " + bytes.available() + " trailing bytes");
            }
            return message;
        } catch (EOFException e) {
            throw new IllegalArgumentException("Malformed message: truncated", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode message", e);
        }
    }

    private static void writePayload(DataOutputStream out, Payload payload) throws IOException {
        out.writeInt(payload.size());
        out.write(payload.toByteArray());
    }

    private static Payload readPayload(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > in.available()) {
            throw new IllegalArgumentException("Malformed message: invalid payload length " + length);
        }
        byte[] value = new byte[length];
        in.readFully(value);
        return Payload.of(value);
    }

    private static PromiseId readId(DataInputStream in) throws IOException {
        byte[] id = new byte[PromiseId.LENGTH];
        in.readFully(id);
        return PromiseId.of(id);
    }

    private static PromiseStatus readStatus(byte code) {
        if (code == STATUS_RESOLVED) {
            return PromiseStatus.RESOLVED;
        }
        if (code == STATUS_REJECTED) {
            return PromiseStatus.REJECTED;
        }
        throw new IllegalArgumentException("Malformed message: unknown status " + code);
    }
}
