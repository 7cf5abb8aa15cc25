package io.chainrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorError;
import io.chainrelay.model.OperatorException;
import io.chainrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keyring backed by a JSON object of {@code keyId -> secret}, either at the top level or
 * under a {@code keys} member. A missing file is an empty keyring.
 */
public final class FileA2aKeyring implements A2aKeyring {
    private final Map<String, byte[]> secrets;

    public FileA2aKeyring(Map<String, String> secrets) {
        Map<String, byte[]> copy = new LinkedHashMap<>();
        secrets.forEach((keyId, secret) -> copy.put(keyId, secret.getBytes(StandardCharsets.UTF_8)));
        this.secrets = Map.copyOf(copy);
    }

    public static FileA2aKeyring load(Path keyFile) {
        if (!Files.isRegularFile(keyFile)) {
            return new FileA2aKeyring(Map.of());
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(keyFile.toFile());
        } catch (IOException e) {
            throw new OperatorException(
                    OperatorError.of(ErrorCode.A2A_CONFIG_INVALID, "A2A key file is not valid JSON: " + keyFile),
                    e
            );
        }
        JsonNode keys = root.has("keys") ? root.get("keys") : root;
        if (keys == null || !keys.isObject()) {
            throw new OperatorException(ErrorCode.A2A_CONFIG_INVALID, "A2A key file must map key ids to secrets: " + keyFile);
        }
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = keys.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String secret = entry.getValue().asText("");
            if (entry.getKey().isBlank() || secret.isBlank()) {
                throw new OperatorException(ErrorCode.A2A_CONFIG_INVALID,
                        "A2A key entries need a non-empty id and secret: " + keyFile);
            }
            out.put(entry.getKey().trim(), secret);
        }
        return new FileA2aKeyring(out);
    }

    @Override
    public Optional<byte[]> secretFor(String keyId) {
        byte[] secret = secrets.get(keyId);
        return secret == null ? Optional.empty() : Optional.of(secret.clone());
    }

    public int size() {
        return secrets.size();
    }
}
