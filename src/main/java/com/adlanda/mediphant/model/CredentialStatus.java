package com.adlanda.mediphant.model;

public enum CredentialStatus {
    PRESENT,
    ABSENT;

    public static CredentialStatus of(String credential) {
        return credential != null && !credential.isBlank() ? PRESENT : ABSENT;
    }
}
