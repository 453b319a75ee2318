package com.autonomous.content.service;

import com.autonomous.content.exception.InvalidRequestException;
import com.autonomous.content.exception.ResourceNotFoundException;
import com.autonomous.content.model.CredentialHandle;
import com.autonomous.content.storage.JsonDocumentStore;
import com.autonomous.content.storage.JsonMappers;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Envelope-encrypted store for organization API keys. Each secret is encrypted with its own
 * AES-256 data key, and the data key is wrapped with the master key. Callers only ever hold a
 * {@link CredentialHandle}; plaintext is exposed inside {@link #withSecret} and wiped afterwards.
 * Sealed secrets are persisted under the data path; plaintext never touches disk.
 */
@Service
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final int IV_LENGTH = 12; // bytes

    @Value("${pipeline.data.path:data}")
    private String dataPath;

    private final SecretKeySpec masterKey;
    private final OrganizationService organizations;
    private final AuditLogService auditLog;
    private final SecureRandom secureRandom = new SecureRandom();
    private final Map<String, SealedSecret> secrets = new ConcurrentHashMap<>();
    private JsonDocumentStore<SealedSecret> documents = JsonDocumentStore.inMemory(SealedSecret.class);

    public CredentialVault(@Value("${secrets.master-key:}") String encodedKey,
                           OrganizationService organizations, AuditLogService auditLog) {
        this.organizations = organizations;
        this.auditLog = auditLog;
        if (encodedKey == null || encodedKey.isBlank()) {
            this.masterKey = null;
        } else {
            this.masterKey = new SecretKeySpec(Base64.getDecoder().decode(encodedKey), "AES");
        }
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @PostConstruct
    public void init() {
        validateKey();
        if (dataPath == null || dataPath.isBlank()) {
            return;
        }
        documents = new JsonDocumentStore<>(Paths.get(dataPath, "api-keys"), SealedSecret.class, JsonMappers.json());
        try {
            documents.loadAll().forEach(sealed -> {
                CredentialHandle handle = sealed.handle();
                secrets.put(key(handle.organizationId(), handle.service()), sealed);
            });
            log.info("Loaded {} API keys from {}", secrets.size(), dataPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load API keys from " + dataPath, e);
        }
    }

    void validateKey() {
        if (masterKey == null) {
            throw new IllegalStateException(
                "SECRETS_MASTER_KEY is not set. Cannot start without a master key for API key storage.");
        }
        if (masterKey.getEncoded().length != 32) {
            throw new IllegalStateException(
                "SECRETS_MASTER_KEY must be a Base64-encoded 256-bit (32-byte) key. Got "
                    + masterKey.getEncoded().length + " bytes.");
        }
    }

    /**
     * Stores the key for one service, replacing (rotating) any existing one.
     */
    public CredentialHandle store(String organizationId, String service, String plaintext, String actorId) {
        organizations.requireAdmin(organizationId, actorId);
        if (service == null || service.isBlank()) {
            throw new InvalidRequestException("Service name is required");
        }
        if (plaintext == null || plaintext.isBlank()) {
            throw new InvalidRequestException("API key must not be empty");
        }

        SealedSecret sealed = seal(organizationId, service, plaintext.getBytes(StandardCharsets.UTF_8), hint(plaintext));
        persist(sealed);
        SealedSecret previous = secrets.put(key(organizationId, service), sealed);
        if (previous != null) {
            discard(previous);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("service", service);
        details.put("hint", sealed.handle().hint());
        if (previous != null) {
            details.put("previousKeyId", previous.handle().id());
        }
        String action = previous == null ? "api_key.created" : "api_key.rotated";
        auditLog.recordEvent(organizationId, actorId, action, "api_key", sealed.handle().id(), details);
        log.info("{} API key for organization {} service {}",
            previous == null ? "Stored" : "Rotated", organizationId, service);
        return sealed.handle();
    }

    public Optional<CredentialHandle> handleFor(String organizationId, String service) {
        return Optional.ofNullable(secrets.get(key(organizationId, service))).map(SealedSecret::handle);
    }

    public void revoke(String organizationId, String service, String actorId) {
        organizations.requireAdmin(organizationId, actorId);
        SealedSecret removed = secrets.remove(key(organizationId, service));
        if (removed == null) {
            throw new ResourceNotFoundException("API key", service);
        }
        discard(removed);
        auditLog.recordEvent(organizationId, actorId, "api_key.revoked", "api_key", removed.handle().id(),
            Map.of("service", service));
        log.info("Revoked API key for organization {} service {}", organizationId, service);
    }

    /**
     * Decrypts the secret behind {@code handle} and passes it to {@code action}. The buffer is
     * zeroed when the action returns.
     */
    public <T> T withSecret(CredentialHandle handle, Function<char[], T> action) {
        SealedSecret sealed = secrets.get(key(handle.organizationId(), handle.service()));
        if (sealed == null || !sealed.handle().id().equals(handle.id())) {
            throw new ResourceNotFoundException("API key", handle.id());
        }
        byte[] plaintext = unseal(sealed);
        CharBuffer chars = StandardCharsets.UTF_8.decode(ByteBuffer.wrap(plaintext));
        char[] secret = new char[chars.remaining()];
        chars.get(secret);
        try {
            return action.apply(secret);
        } finally {
            Arrays.fill(secret, '\0');
            Arrays.fill(plaintext, (byte) 0);
            if (chars.hasArray()) {
                Arrays.fill(chars.array(), '\0');
            }
        }
    }

    private SealedSecret seal(String organizationId, String service, byte[] plaintext, String hint) {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(256, secureRandom);
            byte[] dataKey = generator.generateKey().getEncoded();

            byte[] secretIv = generateIv();
            byte[] ciphertext = encrypt(new SecretKeySpec(dataKey, "AES"), plaintext, secretIv);
            byte[] keyIv = generateIv();
            byte[] wrappedKey = encrypt(masterKey, dataKey, keyIv);
            Arrays.fill(dataKey, (byte) 0);
            Arrays.fill(plaintext, (byte) 0);

            CredentialHandle handle = new CredentialHandle(UUID.randomUUID().toString(), organizationId, service, hint);
            return new SealedSecret(handle, wrappedKey, keyIv, ciphertext, secretIv);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    private void persist(SealedSecret sealed) {
        try {
            documents.save(sealed.handle().id(), sealed);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist API key " + sealed.handle().id(), e);
        }
    }

    private void discard(SealedSecret sealed) {
        try {
            documents.delete(sealed.handle().id());
        } catch (IOException e) {
            log.error("Failed to delete API key file {}", sealed.handle().id(), e);
        }
    }

    private byte[] unseal(SealedSecret sealed) {
        byte[] dataKey = decrypt(masterKey, sealed.wrappedKey(), sealed.keyIv());
        try {
            return decrypt(new SecretKeySpec(dataKey, "AES"), sealed.ciphertext(), sealed.secretIv());
        } finally {
            Arrays.fill(dataKey, (byte) 0);
        }
    }

    private byte[] generateIv() {
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);
        return iv;
    }

    private static byte[] encrypt(SecretKeySpec key, byte[] plaintext, byte[] iv) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return cipher.doFinal(plaintext);
    }

    private static byte[] decrypt(SecretKeySpec key, byte[] ciphertext, byte[] iv) {
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Decryption failed", e);
        }
    }

    private static String hint(String plaintext) {
        return plaintext.length() <= 4 ? "****" : "..." + plaintext.substring(plaintext.length() - 4);
    }

    private static String key(String organizationId, String service) {
        return organizationId + "|" + service;
    }

    record SealedSecret(CredentialHandle handle, byte[] wrappedKey, byte[] keyIv,
                                byte[] ciphertext, byte[] secretIv) {}
}
