package app.tiered.entitlement.support;

public final class ErrorSummary {

    private ErrorSummary() {
    }

    public static String of(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        String fallback = throwable.getMessage();
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        return throwable.getClass().getSimpleName();
    }
}
