package com.talentscout.scoring;

import com.talentscout.model.EmailConfidence;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EmailConfidenceClassifierTest {
    private final EmailConfidenceClassifier classifier = new EmailConfidenceClassifier();

    @Test
    void noReplyAddressShouldBeMailingList() {
        EmailConfidence c = classifier.classify("no-reply@service.io", "github", "Jane Doe");

        assertEquals(20, c.score);
        assertEquals(EmailConfidence.Level.LOW, c.level);
        assertEquals(EmailConfidence.Type.MAILING_LIST, c.type);
    }

    @Test
    void personalDomainWithNameShouldBeHigh() {
        EmailConfidence c = classifier.classify("jane.doe@gmail.com", "github", "Jane Doe");

        assertEquals(95, c.score);
        assertEquals(EmailConfidence.Level.HIGH, c.level);
        assertEquals(EmailConfidence.Type.PERSONAL, c.type);
    }

    @Test
    void personalDomainWithoutNameShouldBeMedium() {
        EmailConfidence c = classifier.classify("coolcoder88@yahoo.com", "stackoverflow", "Jane Doe");

        assertEquals(75, c.score);
        assertEquals(EmailConfidence.Level.MEDIUM, c.level);
        assertEquals(EmailConfidence.Type.PERSONAL, c.type);
    }

    @Test
    void bigCompanyDomainShouldBeLowGeneric() {
        EmailConfidence c = classifier.classify("jdoe@microsoft.com", "linkedin", "Jane Doe");

        assertEquals(40, c.score);
        assertEquals(EmailConfidence.Type.GENERIC, c.type);
    }

    @Test
    void otherDomainShouldBeWork() {
        EmailConfidence c = classifier.classify("Jane@Acme-Robotics.de", "google", "Jane Doe");

        assertEquals(85, c.score);
        assertEquals(EmailConfidence.Level.HIGH, c.level);
        assertEquals(EmailConfidence.Type.WORK, c.type);
    }

    @Test
    void missingOrMalformedAddressShouldUseFallbacks() {
        assertEquals(0, classifier.classify(null, "github", "x").score);
        assertEquals(0, classifier.classify("   ", "github", "x").score);
        assertEquals(50, classifier.classify("jane.doe", "github", "Jane").score);
        assertEquals(50, classifier.classify("jane@", "github", "Jane").score);
        assertEquals(50, classifier.classify("jane doe@exa mple", "github", "Jane").score);
    }
}
