package com.talentscout.scoring;

import com.talentscout.model.EmailConfidence;
import com.talentscout.model.EmailConfidence.Level;
import com.talentscout.model.EmailConfidence.Type;
import org.apache.commons.validator.routines.EmailValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rates how likely an address reaches the candidate personally.
 */
public final class EmailConfidenceClassifier {
    private static final Logger LOG = LogManager.getLogger(EmailConfidenceClassifier.class);

    private static final List<String> MAILING_LIST_PATTERNS = List.of(
            "unsubscribe", "subscribe", "noreply", "no-reply", "donotreply", "mailer-daemon"
    );
    private static final Set<String> PERSONAL_DOMAINS = Set.of(
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "icloud.com"
    );
    private static final Set<String> GENERIC_COMPANY_DOMAINS = Set.of(
            "microsoft.com", "google.com", "amazon.com", "meta.com", "apple.com"
    );

    private static final EmailConfidence NONE = new EmailConfidence(0, Level.LOW, Type.GENERIC);
    private static final EmailConfidence MAILING_LIST = new EmailConfidence(20, Level.LOW, Type.MAILING_LIST);
    private static final EmailConfidence PERSONAL_MATCHED = new EmailConfidence(95, Level.HIGH, Type.PERSONAL);
    private static final EmailConfidence PERSONAL_UNMATCHED = new EmailConfidence(75, Level.MEDIUM, Type.PERSONAL);
    private static final EmailConfidence COMPANY_GENERIC = new EmailConfidence(40, Level.LOW, Type.GENERIC);
    private static final EmailConfidence WORK = new EmailConfidence(85, Level.HIGH, Type.WORK);
    private static final EmailConfidence FALLBACK = new EmailConfidence(50, Level.MEDIUM, Type.GENERIC);

    private final EmailValidator validator = EmailValidator.getInstance();

    public EmailConfidence classify(String email, String sourcePlatform, String profileName) {
        String address = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        if (address.isEmpty()) {
            return NONE;
        }
        int at = address.lastIndexOf('@');
        if (at <= 0 || at == address.length() - 1) {
            LOG.debug("malformed email from source={}", sourcePlatform);
            return FALLBACK;
        }
        String local = address.substring(0, at);
        String domain = address.substring(at + 1);

        for (String pattern : MAILING_LIST_PATTERNS) {
            if (local.contains(pattern)) {
                return MAILING_LIST;
            }
        }
        if (!validator.isValid(address)) {
            LOG.debug("unverifiable email from source={}", sourcePlatform);
            return FALLBACK;
        }
        if (PERSONAL_DOMAINS.contains(domain)) {
            return containsNameFragment(local, profileName) ? PERSONAL_MATCHED : PERSONAL_UNMATCHED;
        }
        if (GENERIC_COMPANY_DOMAINS.contains(domain)) {
            return COMPANY_GENERIC;
        }
        return WORK;
    }

    private static boolean containsNameFragment(String local, String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        for (String word : name.toLowerCase(Locale.ROOT).split("\\s+")) {
            String letters = word.replaceAll("[^\\p{L}\\p{N}]", "");
            if (letters.length() < 2) {
                continue;
            }
            String fragment = letters.length() > 3 ? letters.substring(0, 3) : letters;
            if (local.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
