package com.autonomous.content.model;

/**
 * Opaque reference to an encrypted organization credential. Carries no key material.
 *
 * @param hint last four characters of the plaintext, for display only
 */
public record CredentialHandle(String id, String organizationId, String service, String hint) {}
