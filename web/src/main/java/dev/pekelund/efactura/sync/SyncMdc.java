package dev.pekelund.efactura.sync;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so log lines of one company pass share the company id, message id and stage.
 */
final class SyncMdc {

    private static final String KEY_COMPANY_ID = "invoice.companyId";
    private static final String KEY_MESSAGE_ID = "invoice.messageId";
    private static final String KEY_STAGE = "invoice.stage";

    private SyncMdc() {
    }

    static Context open(String companyId) {
        return new Context(companyId);
    }

    static void attachMessage(String messageId) {
        putIfHasText(KEY_MESSAGE_ID, messageId);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String companyId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_COMPANY_ID, companyId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
