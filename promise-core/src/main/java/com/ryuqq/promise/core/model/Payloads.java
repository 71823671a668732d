package com.ryuqq.promise.core.model;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * 여러 Payload를 순서를 보존하여 하나로 묶거나 다시 펼칩니다.
 *
 * <p>원자적 fan-out 결과와 Promise.all 결과를 부모 Promise 값으로 전달할 때 사용합니다.</p>
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * [count: int32] ([length: int32][bytes])*
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payloads {

    private Payloads() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Payload 목록을 하나로 묶기.
     *
     * @param items 순서가 있는 Payload 목록
     * @return 묶인 Payload
     * @throws IllegalArgumentException items가 null이거나 null 요소를 포함하는 경우
     */
    public static Payload pack(List<Payload> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        int size = Integer.BYTES;
        for (Payload item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null");
            }
            size += Integer.BYTES + item.size();
        }

        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.putInt(items.size());
        for (Payload item : items) {
            buffer.putInt(item.size());
            buffer.put(item.toByteArray());
        }
        return Payload.of(buffer.array());
    }

    /**
     * 묶인 Payload를 목록으로 펼치기.
     *
     * @param packed {@link #pack(List)}로 만든 Payload
     * @return 원래 순서의 Payload 목록
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static List<Payload> unpack(Payload packed) {
        if (packed == null) {
            throw new IllegalArgumentException("packed cannot be null");
        }
        ByteBuffer buffer = ByteBuffer.wrap(packed.toByteArray());
        try {
            int count = buffer.getInt();
            if (count < 0) {
                throw new IllegalArgumentException("Malformed packed payload: negative count " + count);
            }
            List<Payload> items = new ArrayList<>(Math.min(count, 1024));
            for (int i = 0; i < count; i++) {
                int length = buffer.getInt();
                if (length < 0 || length > buffer.remaining()) {
                    throw new IllegalArgumentException("Malformed packed payload: invalid length " + length + " at item " + i);
                }
                byte[] bytes = new byte[length];
                buffer.get(bytes);
                items.add(Payload.of(bytes));
            }
            if (buffer.hasRemaining()) {
                throw new IllegalArgumentException("Malformed packed payload: " + buffer.remaining() + " trailing bytes");
            }
            return List.copyOf(items);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Malformed packed payload: truncated", e);
        }
    }
}
