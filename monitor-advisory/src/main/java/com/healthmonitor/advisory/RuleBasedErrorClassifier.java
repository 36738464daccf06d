package com.healthmonitor.advisory;

import com.healthmonitor.core.model.ErrorCategory;
import com.healthmonitor.core.model.ErrorClassification;
import com.healthmonitor.core.model.Severity;

import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Deterministic keyword classifier. Used whenever the external capability
 * is unavailable, slow or wrong, so it never throws.
 *
 * Rules are evaluated in order and the first match wins. The order matters:
 * "declined" is checked before auth, and compliance before rate limiting
 * because "wage rate" mentions "rate".
 */
public class RuleBasedErrorClassifier implements ErrorClassifier {

    private final List<Rule> rules = List.of(
        new Rule(
            r -> containsAny(r, "spending", "spending_limit", "declined") || codeIs(r, "card_declined"),
            r -> new ErrorClassification(
                ErrorCategory.SPENDING_CONTROL,
                Severity.HIGH,
                "Card transaction was declined due to spending controls or insufficient funds.",
                "Review the cardholder limits in Stripe. If legitimate, temporarily increase the limit "
                    + "or use an alternative payment method.",
                List.of("card_transaction"),
                "Field worker may be unable to purchase materials, potentially delaying job progress.")),
        new Rule(
            r -> containsAny(r, "oauth", "token expired", "unauthorized", "re-auth") || codeIs(r, "401"),
            r -> new ErrorClassification(
                ErrorCategory.AUTH,
                Severity.HIGH,
                "Authentication failed for " + r.integration().id()
                    + ". The access token may have expired or been revoked.",
                "Re-authenticate the integration by going to Settings > Integrations and clicking "
                    + "\"Reconnect\" for this service.",
                List.of("all sync operations"),
                "No data will sync until the connection is restored, potentially affecting payroll and job costing.")),
        new Rule(
            r -> containsAny(r, "prevailing wage", "wage rate", "apprentice", "fringe",
                "wh-347", "lcptracker", "certified payroll"),
            r -> new ErrorClassification(
                ErrorCategory.COMPLIANCE,
                Severity.CRITICAL,
                "Certified payroll compliance check failed. Required wage or worker data is missing or incorrect.",
                "Review the affected worker classifications and wage rates. Ensure all required fields "
                    + "(apprentice info, prevailing wage rates, fringe benefits) are configured before the "
                    + "submission deadline.",
                List.of("certified_payroll_report", "worker_classifications"),
                "Compliance reports cannot be submitted until resolved, risking regulatory penalties and payment delays.")),
        new Rule(
            r -> containsAny(r, "rate limit", "too many requests", "429") || codeIs(r, "429"),
            r -> new ErrorClassification(
                ErrorCategory.RATE_LIMIT,
                Severity.LOW,
                r.integration().id() + " rate limit exceeded. Too many requests were made in a short period.",
                "This will auto-resolve. If frequent, consider spacing out bulk operations or requesting "
                    + "a higher rate limit from the provider.",
                List.of("pending sync items"),
                "Temporary delay in data sync. Will automatically retry.")),
        new Rule(
            r -> containsAny(r, "timeout", "timed out", "connection refused", "connection reset",
                    "failed to establish connection", "econnrefused", "econnreset", "enotfound", "dns lookup",
                    "dns resolution", "getaddrinfo",
                    "bad gateway", "service unavailable", "gateway timeout")
                || NETWORK_CODES.contains(r.normalizedCode()),
            r -> new ErrorClassification(
                ErrorCategory.NETWORK,
                Severity.MEDIUM,
                "Could not reach " + r.integration().id()
                    + ". The connection timed out or was refused before a response arrived.",
                "Usually transient and retried by the next scheduled sync. If it persists, check the "
                    + "provider's status page and any recent firewall or proxy changes.",
                List.of("pending sync items"),
                "Data sync is delayed until connectivity to the provider is restored.")),
        new Rule(
            r -> containsAny(r, "validation", "required", "invalid", "null"),
            r -> new ErrorClassification(
                ErrorCategory.DATA_VALIDATION,
                Severity.MEDIUM,
                "Data validation failed. The " + r.integration().id()
                    + " payload contains missing or invalid fields.",
                "Review the failed record for missing required fields. Check if recent changes in the "
                    + "source system affected the data format.",
                List.of(r.eventType()),
                "Affected records will not sync until the data issues are resolved.")),
        new Rule(
            r -> containsAny(r, "archived", "not found", "entity not found", "mapping failed") || codeIs(r, "404"),
            r -> new ErrorClassification(
                ErrorCategory.DATA_STATE_MISMATCH,
                Severity.MEDIUM,
                "The referenced entity in " + r.integration().id() + " has been archived, deleted, or cannot "
                    + "be found. This often happens when data is modified in the external system without "
                    + "updating the integration.",
                "Review the affected record in both systems. Either restore the entity in the source system "
                    + "or update the mapping in your application.",
                List.of(r.eventType()),
                "Related data will not sync until the entity reference is corrected."))
    );

    private static final Set<String> NETWORK_CODES = Set.of(
        "timeout", "etimedout", "connection_error", "econnrefused", "econnreset", "enotfound",
        "502", "503", "504");

    @Override
    public ErrorClassification classify(ClassificationRequest request) {
        for (Rule rule : rules) {
            if (rule.matches().test(request)) {
                return rule.classification().apply(request);
            }
        }
        return unknown(request);
    }

    @Override
    public String name() {
        return "rule-based";
    }

    private static ErrorClassification unknown(ClassificationRequest request) {
        return new ErrorClassification(
            ErrorCategory.UNKNOWN,
            Severity.MEDIUM,
            "An unexpected error occurred with " + request.integration().id() + ": " + request.errorMessage(),
            "Review the error details and contact support if the issue persists. Check the integration "
                + "logs for more context.",
            List.of(request.eventType()),
            "Some data may not sync correctly until the issue is resolved.");
    }

    private static boolean containsAny(ClassificationRequest request, String... keywords) {
        String message = request.normalizedMessage();
        for (String keyword : keywords) {
            if (message.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static boolean codeIs(ClassificationRequest request, String code) {
        return request.normalizedCode().equals(code);
    }

    private record Rule(
        Predicate<ClassificationRequest> matches,
        Function<ClassificationRequest, ErrorClassification> classification
    ) {}
}
