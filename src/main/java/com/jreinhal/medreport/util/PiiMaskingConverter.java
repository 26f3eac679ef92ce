package com.jreinhal.medreport.util;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.regex.Pattern;

/**
 * Best-effort PHI scrubbing for log output.
 *
 * Only targets the identifiers that reach this service: 13-digit national ids, e-mail addresses and phone numbers.
 * Report content is never logged in the first place.
 */
public class PiiMaskingConverter extends ClassicConverter {
    private static final Pattern NATIONAL_ID = Pattern.compile("\\b\\d{13}\\b");
    private static final Pattern EMAIL = Pattern.compile(
        "\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern PHONE = Pattern.compile(
        "(?<![\\w-])(?:\\+\\d{1,3}[\\s.-]?)?\\(?0?\\d{2,3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{3,4}(?![\\w-])"
    );

    @Override
    public String convert(ILoggingEvent event) {
        return mask(event.getFormattedMessage());
    }

    static String mask(String msg) {
        if (msg == null || msg.isEmpty()) {
            return "";
        }

        String sanitized = msg;
        sanitized = NATIONAL_ID.matcher(sanitized).replaceAll("[NID-REDACTED]");
        sanitized = EMAIL.matcher(sanitized).replaceAll("[EMAIL-REDACTED]");
        sanitized = PHONE.matcher(sanitized).replaceAll("[PHONE-REDACTED]");

        return sanitized;
    }
}
