package io.chainrelay.policy;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.OperatorError;
import io.chainrelay.model.OperatorException;
import io.chainrelay.util.Jsons;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Loads a {@link PolicyDocument} from JSON. Structural problems are collected and
 * reported together as {@code POLICY_INVALID}.
 */
public final class PolicyLoader {
    private static final Set<String> TOP_LEVEL_FIELDS = Set.of(
            "version", "allowMainnetOnly", "requireKeySegregation", "requireSimulation",
            "defaultDryRun", "allowlists", "limits", "stableAssets", "referencePricesUsd"
    );

    private PolicyLoader() {
    }

    public static PolicyDocument load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new OperatorException(
                    ErrorCode.POLICY_NOT_FOUND,
                    "Policy file not found: " + file,
                    Map.of("path", String.valueOf(file))
            );
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new OperatorException(
                    OperatorError.of(ErrorCode.POLICY_INVALID, "Policy file is not valid JSON: " + file,
                            Map.of("path", file.toString())),
                    e
            );
        }
        return parse(root);
    }

    public static PolicyDocument parse(JsonNode root) {
        List<String> errors = new ArrayList<>();
        if (root == null || !root.isObject()) {
            throw invalid(List.of("policy must be a JSON object"));
        }
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!TOP_LEVEL_FIELDS.contains(name)) {
                errors.add("unknown field: " + name);
            }
        }
        String version = root.path("version").asText("").trim();
        if (version.isEmpty()) {
            errors.add("version is required");
        }
        boolean allowMainnetOnly = bool(root, "allowMainnetOnly", true, errors);
        boolean requireKeySegregation = bool(root, "requireKeySegregation", true, errors);
        boolean requireSimulation = bool(root, "requireSimulation", false, errors);
        boolean defaultDryRun = bool(root, "defaultDryRun", false, errors);

        JsonNode lists = root.path("allowlists");
        if (!lists.isMissingNode() && !lists.isObject()) {
            errors.add("allowlists must be an object");
        }
        PolicyDocument.Allowlists allowlists = new PolicyDocument.Allowlists(
                strings(lists, "chains", errors, PolicyLoader::lower),
                strings(lists, "assets", errors, PolicyLoader::upper),
                strings(lists, "recipients", errors, PolicyLoader::address),
                strings(lists, "bridgeRoutes", errors, PolicyLoader::route),
                strings(lists, "symbols", errors, PolicyLoader::upper)
        );

        JsonNode limitsNode = root.path("limits");
        if (!limitsNode.isMissingNode() && !limitsNode.isObject()) {
            errors.add("limits must be an object");
        }
        Integer maxSlippage = null;
        JsonNode slippage = limitsNode.path("maxSlippageBps");
        if (!slippage.isMissingNode() && !slippage.isNull()) {
            if (!slippage.canConvertToInt() || !slippage.isIntegralNumber() || slippage.asInt() < 0) {
                errors.add("limits.maxSlippageBps must be a non-negative integer");
            } else {
                maxSlippage = slippage.asInt();
            }
        }
        PolicyDocument.Limits limits = new PolicyDocument.Limits(
                decimal(limitsNode, "maxNotionalUsdPerTx", errors),
                decimal(limitsNode, "maxOrderSize", errors),
                maxSlippage,
                decimal(limitsNode, "maxLeverage", errors)
        );
        Set<String> stable = root.has("stableAssets")
                ? strings(root, "stableAssets", errors, PolicyLoader::upper)
                : null;
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        JsonNode pricesNode = root.path("referencePricesUsd");
        if (!pricesNode.isMissingNode() && !pricesNode.isObject()) {
            errors.add("referencePricesUsd must be an object");
        } else if (pricesNode.isObject()) {
            Iterator<String> assets = pricesNode.fieldNames();
            while (assets.hasNext()) {
                String asset = assets.next();
                BigDecimal price = decimal(pricesNode, asset, errors);
                if (price != null) {
                    prices.put(upper(asset.trim()), price);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw invalid(errors);
        }
        return new PolicyDocument(
                version,
                allowMainnetOnly,
                requireKeySegregation,
                requireSimulation,
                defaultDryRun,
                allowlists,
                limits,
                stable,
                prices
        );
    }

    private static OperatorException invalid(List<String> errors) {
        return new OperatorException(
                ErrorCode.POLICY_INVALID,
                "Policy document failed validation",
                Map.of("errors", List.copyOf(errors))
        );
    }

    private static boolean bool(JsonNode root, String field, boolean fallback, List<String> errors) {
        JsonNode node = root.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            errors.add(field + " must be a boolean");
            return fallback;
        }
        return node.booleanValue();
    }

    private static Set<String> strings(JsonNode parent, String field, List<String> errors, UnaryOperator<String> normalizer) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return Set.of();
        }
        if (!node.isArray()) {
            errors.add(field + " must be an array of strings");
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                errors.add(field + " entries must be non-empty strings");
                continue;
            }
            String normalized = normalizer.apply(item.asText().trim());
            if (normalized == null) {
                errors.add(field + " entry is malformed: " + item.asText());
                continue;
            }
            out.add(normalized);
        }
        return out;
    }

    private static BigDecimal decimal(JsonNode parent, String field, List<String> errors) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            BigDecimal value = node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
            if (value.signum() < 0) {
                errors.add(field + " must not be negative");
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            errors.add(field + " must be a decimal");
            return null;
        }
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static String upper(String value) {
        return value.toUpperCase(Locale.ROOT);
    }

    private static String address(String value) {
        return value.startsWith("0x") || value.startsWith("0X") ? value.toLowerCase(Locale.ROOT) : value;
    }

    private static String route(String value) {
        String[] parts = value.toLowerCase(Locale.ROOT).split("->");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return null;
        }
        return parts[0].trim() + "->" + parts[1].trim();
    }
}
