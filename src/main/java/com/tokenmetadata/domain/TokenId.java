package com.tokenmetadata.domain;

import java.util.Objects;

/**
 * Token identity: contract address plus token index. A null token index identifies contract-level metadata.
 */
public record TokenId(String contractAddress, String tokenIndex) {

    public TokenId {
        Objects.requireNonNull(contractAddress, "contractAddress");
        if (contractAddress.isBlank()) {
            throw new IllegalArgumentException("contractAddress must not be blank");
        }
        if (tokenIndex != null && tokenIndex.isBlank()) {
            tokenIndex = null;
        }
    }

    public static TokenId of(String contractAddress, String tokenIndex) {
        return new TokenId(contractAddress, tokenIndex);
    }

    /**
     * Persistence key: {@code contract:index}, or the contract alone for contract-level metadata. Addresses are
     * base58 and case-sensitive, so only surrounding whitespace is stripped.
     */
    public String key() {
        String contract = contractAddress.strip();
        return tokenIndex == null ? contract : contract + ":" + tokenIndex.strip();
    }

    @Override
    public String toString() {
        return key();
    }
}
