package com.ryuqq.promise.core.model;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 결정적 PromiseId 파생 함수.
 *
 * <p>모든 식별자는 도메인 태그와 입력값에 대한 SHA-256 해시입니다.
 * 도메인 태그가 서로 달라 생성 경로가 다른 식별자끼리는 충돌하지 않습니다.</p>
 *
 * <p><strong>파생 규칙:</strong></p>
 * <ul>
 *   <li>create: hash("create", chainId, creator, createNonce)</li>
 *   <li>then (continuation): hash("then", chainId, parentId, registrationNonce)</li>
 *   <li>cross-chain then: hash("remote", parentId, destination, registrationNonce)</li>
 *   <li>Promise.all: hash("all", chainId, creator, createNonce)</li>
 * </ul>
 *
 * <p>registrationNonce는 부모 Promise마다 독립적으로 증가하는 카운터입니다.
 * 같은 입력은 어느 체인에서 계산해도 같은 식별자를 만듭니다. continuation은 등록 체인을
 * 입력에 포함하므로 공유된 부모에 다른 체인이 then을 걸어도 원래 체인의 continuation과
 * 겹치지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PromiseIds {

    private static final String ALGORITHM = "SHA-256";

    private PromiseIds() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * create()로 생성되는 Promise의 식별자.
     *
     * @param chainId 생성 체인
     * @param creator 생성자
     * @param nonce 체인 내 생성 순번
     * @return PromiseId
     */
    public static PromiseId forCreate(ChainId chainId, Address creator, long nonce) {
        requireNonNull(chainId, "chainId");
        requireNonNull(creator, "creator");
        byte[] creatorBytes = creator.getValue().getBytes(StandardCharsets.UTF_8);
        ByteBuffer input = ByteBuffer.allocate(Long.BYTES + Integer.BYTES + creatorBytes.length + Long.BYTES)
            .putLong(chainId.getValue())
            .putInt(creatorBytes.length)
            .put(creatorBytes)
            .putLong(nonce);
        return hash("create", input.array());
    }

    /**
     * then 등록으로 생성되는 continuation의 식별자.
     *
     * @param chainId 등록 체인
     * @param parentId 부모 Promise
     * @param registrationNonce 부모의 등록 순번
     * @return PromiseId
     */
    public static PromiseId forContinuation(ChainId chainId, PromiseId parentId, long registrationNonce) {
        requireNonNull(chainId, "chainId");
        requireNonNull(parentId, "parentId");
        ByteBuffer input = ByteBuffer.allocate(Long.BYTES + PromiseId.LENGTH + Long.BYTES)
            .putLong(chainId.getValue())
            .put(parentId.toByteArray())
            .putLong(registrationNonce);
        return hash("then", input.array());
    }

    /**
     * 크로스체인 then 등록의 원격 식별자 (로컬 프록시도 같은 값을 사용).
     *
     * @param parentId 부모 Promise
     * @param destination 목적지 체인
     * @param registrationNonce 부모의 등록 순번
     * @return PromiseId
     */
    public static PromiseId forRemote(PromiseId parentId, ChainId destination, long registrationNonce) {
        requireNonNull(parentId, "parentId");
        requireNonNull(destination, "destination");
        ByteBuffer input = ByteBuffer.allocate(PromiseId.LENGTH + Long.BYTES + Long.BYTES)
            .put(parentId.toByteArray())
            .putLong(destination.getValue())
            .putLong(registrationNonce);
        return hash("remote", input.array());
    }

    /**
     * Promise.all 집계 Promise의 식별자.
     *
     * @param chainId 생성 체인
     * @param creator 요청자
     * @param nonce 체인 내 생성 순번
     * @return PromiseId
     */
    public static PromiseId forAll(ChainId chainId, Address creator, long nonce) {
        requireNonNull(chainId, "chainId");
        requireNonNull(creator, "creator");
        byte[] creatorBytes = creator.getValue().getBytes(StandardCharsets.UTF_8);
        ByteBuffer input = ByteBuffer.allocate(Long.BYTES + Integer.BYTES + creatorBytes.length + Long.BYTES)
            .putLong(chainId.getValue())
            .putInt(creatorBytes.length)
            .put(creatorBytes)
            .putLong(nonce);
        return hash("all", input.array());
    }

    private static PromiseId hash(String domain, byte[] input) {
        MessageDigest digest = newDigest();
        digest.update(domain.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(input);
        return PromiseId.of(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
