package org.perlcheck.critic;

import org.perlcheck.Configuration;
import org.perlcheck.element.Document;
import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.parser.DocumentParser;
import org.perlcheck.policy.Policy;
import org.perlcheck.policy.Severity;
import org.perlcheck.policy.Violation;
import org.perlcheck.policy.subroutines.ProhibitPassingCaptureVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the enabled policies over documents.
 */
public class Critic {
    private static final Logger log = LoggerFactory.getLogger(Critic.class);

    private final List<Policy> policies = new ArrayList<>();

    public Critic() {
        this(PolicyProfile.empty());
    }

    public Critic(PolicyProfile profile) {
        this(profile, availablePolicies());
    }

    public Critic(PolicyProfile profile, List<Policy> candidates) {
        Severity minimum = profile.getSeverity() == null ? Configuration.DEFAULT_SEVERITY : profile.getSeverity();
        for (Policy policy : candidates) {
            if (isEnabled(policy, profile, minimum)) {
                policies.add(policy);
            }
        }
        log.debug("Enabled policies at severity {}: {}", minimum.getLevel(), policies);
    }

    /**
     * A fresh instance of every policy this checker knows.
     */
    public static List<Policy> availablePolicies() {
        List<Policy> all = new ArrayList<>();
        all.add(new ProhibitPassingCaptureVariable());
        return all;
    }

    private static boolean isEnabled(Policy policy, PolicyProfile profile, Severity minimum) {
        if (profile.isExcluded(policy.name())) {
            log.debug("Policy {} is excluded", policy.name());
            return false;
        }
        PolicyProfile.PolicySettings settings = profile.getPolicySettings(policy.name());
        if (settings != null) {
            if (!settings.enabled()) {
                log.debug("Policy {} is disabled", policy.name());
                return false;
            }
            if (settings.severity() != null) {
                policy.setSeverity(settings.severity());
            }
            if (settings.themes() != null) {
                policy.setThemes(settings.themes());
            }
        }
        if (policy.getSeverity().getLevel() < minimum.getLevel()) {
            return false;
        }
        return profile.getTheme() == null || policy.getThemes().contains(profile.getTheme());
    }

    public List<Policy> getPolicies() {
        return Collections.unmodifiableList(policies);
    }

    /**
     * Parses and checks a source.
     *
     * @throws org.perlcheck.diagnostics.PerlCheckException if the source cannot be parsed
     */
    public List<Violation> critique(String source, String fileName) {
        long start = System.nanoTime();
        Document document = DocumentParser.parse(source, fileName);
        List<Violation> violations = critique(document);
        log.debug("Checked {} in {} ms, {} violation(s)", fileName,
                (System.nanoTime() - start) / 1_000_000, violations.size());
        return violations;
    }

    /**
     * Checks a parsed document. Violations are ordered by line and column.
     */
    public List<Violation> critique(Document document) {
        List<Violation> violations = new ArrayList<>();
        for (Policy policy : policies) {
            for (ElementKind kind : policy.appliesTo()) {
                for (Element element : document.find(kind)) {
                    violations.addAll(policy.violates(element, document));
                }
            }
        }
        // Stable, so violations at one place keep policy order.
        Collections.sort(violations);
        return violations;
    }
}
