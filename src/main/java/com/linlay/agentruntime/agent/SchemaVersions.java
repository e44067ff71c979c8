package com.linlay.agentruntime.agent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives a stable integer from an agent type's field layout so persisted state can be invalidated
 * when the layout changes.
 */
public final class SchemaVersions {

    private SchemaVersions() {
    }

    public static int of(Collection<FieldSpec> fields) {
        if (fields == null || fields.isEmpty()) {
            return 0;
        }
        List<String> signatures = fields.stream()
                .map(FieldSpec::signature)
                .sorted()
                .toList();
        String joined = String.join("|", signatures);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(joined.getBytes(StandardCharsets.UTF_8));
            String hex = HexFormat.of().formatHex(digest);
            return (int) Long.parseLong(hex.substring(0, 8), 16);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
