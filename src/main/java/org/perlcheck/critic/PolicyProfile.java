package org.perlcheck.critic;

import org.perlcheck.diagnostics.PerlCheckException;
import org.perlcheck.policy.Severity;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;
import org.snakeyaml.engine.v2.schema.CoreSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * User settings that select and adjust policies, read from a YAML document:
 * <pre>
 * severity: 3
 * theme: bugs
 * verbose: 8
 * exclude:
 *   - Subroutines::ProhibitPassingCaptureVariable
 * policies:
 *   Subroutines::ProhibitPassingCaptureVariable:
 *     severity: 5
 *     themes: [core, bugs, mine]
 *     enabled: true
 * </pre>
 * Every key is optional.
 */
public class PolicyProfile {

    /**
     * Overrides for one policy. Null fields keep the policy's defaults.
     */
    public record PolicySettings(Severity severity, Set<String> themes, boolean enabled) {
    }

    private Severity severity;
    private String theme;
    private String verbose;
    private final Set<String> excluded = new HashSet<>();
    private final Map<String, PolicySettings> policies = new HashMap<>();

    public static PolicyProfile empty() {
        return new PolicyProfile();
    }

    public static PolicyProfile load(Path path) {
        String yaml;
        try {
            yaml = Files.readString(path);
        } catch (IOException e) {
            throw new PerlCheckException("Can't read profile " + path + ": " + e.getMessage(), e);
        }
        return parse(yaml, path.toString());
    }

    public static PolicyProfile parse(String yaml, String sourceName) {
        LoadSettings settings = LoadSettings.builder()
                .setSchema(new CoreSchema())
                .build();
        Object document;
        try {
            document = new Load(settings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new PerlCheckException("Invalid profile " + sourceName + ": " + e.getMessage(), e);
        }

        PolicyProfile profile = new PolicyProfile();
        if (document == null) {
            return profile;
        }
        Map<?, ?> root = asMap(document, sourceName, "profile");
        for (Map.Entry<?, ?> entry : root.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "severity" -> profile.severity = asSeverity(value, sourceName, key);
                case "theme" -> profile.theme = value == null ? null : String.valueOf(value);
                case "verbose" -> profile.verbose = value == null ? null : String.valueOf(value);
                case "exclude" -> profile.excluded.addAll(asStrings(value, sourceName, key));
                case "policies" -> {
                    for (Map.Entry<?, ?> policy : asMap(value, sourceName, key).entrySet()) {
                        String name = String.valueOf(policy.getKey());
                        profile.policies.put(name, asPolicySettings(policy.getValue(), sourceName, name));
                    }
                }
                default -> throw new PerlCheckException("Invalid profile " + sourceName + ": unknown key \"" + key + "\"");
            }
        }
        return profile;
    }

    private static PolicySettings asPolicySettings(Object value, String sourceName, String name) {
        if (value == null) {
            return new PolicySettings(null, null, true);
        }
        Map<?, ?> map = asMap(value, sourceName, name);
        Severity severity = null;
        Set<String> themes = null;
        boolean enabled = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            switch (key) {
                case "severity" -> severity = asSeverity(entry.getValue(), sourceName, name + "." + key);
                case "themes" -> themes = new HashSet<>(asStrings(entry.getValue(), sourceName, name + "." + key));
                case "enabled" -> {
                    if (!(entry.getValue() instanceof Boolean)) {
                        throw new PerlCheckException("Invalid profile " + sourceName + ": "
                                + name + ".enabled must be true or false");
                    }
                    enabled = (Boolean) entry.getValue();
                }
                default -> throw new PerlCheckException("Invalid profile " + sourceName + ": unknown key \""
                        + name + "." + key + "\"");
            }
        }
        return new PolicySettings(severity, themes, enabled);
    }

    private static Map<?, ?> asMap(Object value, String sourceName, String key) {
        if (!(value instanceof Map)) {
            throw new PerlCheckException("Invalid profile " + sourceName + ": " + key + " must be a mapping");
        }
        return (Map<?, ?>) value;
    }

    private static List<String> asStrings(Object value, String sourceName, String key) {
        if (value instanceof String) {
            return List.of(((String) value).trim().split("\\s+"));
        }
        if (!(value instanceof List)) {
            throw new PerlCheckException("Invalid profile " + sourceName + ": " + key + " must be a list");
        }
        return ((List<?>) value).stream().map(String::valueOf).toList();
    }

    private static Severity asSeverity(Object value, String sourceName, String key) {
        try {
            return Severity.parse(String.valueOf(value));
        } catch (IllegalArgumentException e) {
            throw new PerlCheckException("Invalid profile " + sourceName + ": " + key + ": " + e.getMessage(), e);
        }
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getTheme() {
        return theme;
    }

    public void setTheme(String theme) {
        this.theme = theme;
    }

    public String getVerbose() {
        return verbose;
    }

    public void setVerbose(String verbose) {
        this.verbose = verbose;
    }

    public boolean isExcluded(String policyName) {
        return excluded.contains(policyName);
    }

    public void exclude(String policyName) {
        excluded.add(policyName);
    }

    public PolicySettings getPolicySettings(String policyName) {
        return policies.get(policyName);
    }
}
