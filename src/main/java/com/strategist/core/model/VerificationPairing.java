package com.strategist.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Naming rules that pair implementation tasks with their verification tasks.
 * <p>
 * Verification tasks carry the {@code test_} prefix. An implementation task
 * {@code impl_x} pairs with {@code test_x}; any other task {@code x} pairs with
 * {@code test_x}.
 */
public final class VerificationPairing {

    public static final String VERIFICATION_PREFIX = "test_";
    public static final String IMPLEMENTATION_PREFIX = "impl_";

    /** Task-name keywords marking validation or deployment work that is never paired. */
    public static final List<String> EXEMPT_KEYWORDS = List.of("validate", "deploy", "verify", "check");

    private VerificationPairing() {}

    public static boolean isVerificationId(String taskId) {
        return taskId != null && taskId.startsWith(VERIFICATION_PREFIX);
    }

    public static String verificationIdFor(String taskId) {
        if (taskId.startsWith(IMPLEMENTATION_PREFIX)) {
            return VERIFICATION_PREFIX + taskId.substring(IMPLEMENTATION_PREFIX.length());
        }
        return VERIFICATION_PREFIX + taskId;
    }

    /** True if the task name contains one of the {@link #EXEMPT_KEYWORDS}. */
    public static boolean isExempt(Task task) {
        String name = task.name() == null ? "" : task.name().toLowerCase(Locale.ROOT);
        return EXEMPT_KEYWORDS.stream().anyMatch(name::contains);
    }

    /** An implementation task is neither a verification task nor exempt validation/deployment work. */
    public static boolean isImplementation(Task task) {
        return !task.isVerification() && !isExempt(task);
    }
}
