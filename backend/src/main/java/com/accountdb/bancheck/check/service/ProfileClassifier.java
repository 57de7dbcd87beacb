package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.model.ProfileClassification;
import com.accountdb.bancheck.check.model.StatusSummary;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

public final class ProfileClassifier {
    static final String UNEXPECTED_STRUCTURE = "unexpected profile structure";
    static final String PRIVATE_DETAILS = "profile is private";
    static final String CLEAN_DETAILS = "no bans on record";

    private ProfileClassifier() {}

    public static ProfileClassification classify(String html) {
        if (html == null || html.isBlank()) {
            return new ProfileClassification(StatusSummary.ERROR, "empty profile response");
        }
        Document document = Jsoup.parse(html);
        Element banInfo = document.selectFirst("span.profile_ban_info, div.profile_ban_info");
        if (banInfo != null) {
            String text = normalizeWhitespace(banInfo.text());
            return new ProfileClassification(StatusSummary.BANNED, text.isEmpty() ? "ban on record" : text);
        }
        if (document.selectFirst("div.profile_private_info") != null) {
            return new ProfileClassification(StatusSummary.PRIVATE, PRIVATE_DETAILS);
        }
        if (document.selectFirst("div.profile_header_centered_persona") != null) {
            return new ProfileClassification(StatusSummary.CLEAN, CLEAN_DETAILS);
        }
        Element errorPage = document.selectFirst("div.error_ctn, #message");
        if (errorPage != null) {
            String text = normalizeWhitespace(errorPage.text());
            return new ProfileClassification(
                StatusSummary.ERROR,
                text.isEmpty() ? UNEXPECTED_STRUCTURE : "profile error page: " + text
            );
        }
        return new ProfileClassification(StatusSummary.ERROR, UNEXPECTED_STRUCTURE);
    }

    private static String normalizeWhitespace(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }
}
