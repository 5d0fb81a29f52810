package com.example.FolioAgent.service;

import com.example.FolioAgent.config.AgentProperties;
import com.example.FolioAgent.model.DraftResponse;
import com.example.FolioAgent.model.EnrichedContext;
import com.example.FolioAgent.model.RequestState;
import com.example.FolioAgent.model.RetrievalResult;
import com.example.FolioAgent.model.RetryAction;
import com.example.FolioAgent.model.ValidationOutcome;
import com.example.FolioAgent.util.CitationExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guardrail gate between a draft and the caller.
 * <p>
 * Checks run in a fixed order: generation failure, safety, length, quality.
 * An unsafe draft is never retried, whatever else is wrong with it; length and
 * quality problems are retried while the request has retries left.
 */
@Component
@RequiredArgsConstructor
public class ResponseValidator {

    static final String CHECK_LENGTH = "length";
    static final String CHECK_QUALITY = "quality";
    static final String CHECK_SAFETY = "safety";

    private static final List<Pattern> REFUSALS = List.of(
            Pattern.compile("^\\W*as an ai(\\s+language)?\\s+model\\b"),
            Pattern.compile("^\\W*(i'?m sorry|sorry)[,.!]?\\s+(but\\s+)?i\\s+(can ?not|can'?t|am unable to|won'?t)\\b"),
            Pattern.compile("^\\W*i\\s+(can ?not|can'?t|am unable to)\\s+(help|answer|assist)\\b")
    );

    private static final List<Pattern> SECRETS = List.of(
            Pattern.compile("\\bsk-[A-Za-z0-9_-]{20,}"),
            Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"),
            Pattern.compile("\\bgh[pousr]_[A-Za-z0-9]{36,}\\b"),
            Pattern.compile("-----BEGIN [A-Z ]*PRIVATE KEY-----"),
            Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b")
    );

    private static final List<Pattern> PROMPT_LEAKS = List.of(
            Pattern.compile("\\b(my|the) system prompt (is|says)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bignore (all )?previous instructions\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcite every chunk you rely on\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}']+");

    private final AgentProperties properties;

    public ValidationOutcome validate(DraftResponse draft, RequestState state) {
        if (draft == null || draft.generationFailed()) {
            String reason = draft == null ? "no draft" : draft.failureReason();
            return qualityFailure("generation failed: " + reason, state);
        }

        String text = draft.text();
        AgentProperties.Validation cfg = properties.getValidation();

        String safetyProblem = safetyProblem(text);
        if (safetyProblem != null) {
            return ValidationOutcome.failedSafe(CHECK_SAFETY, safetyProblem);
        }

        if (text.length() < cfg.getMinLength()) {
            String reason = "answer shorter than " + cfg.getMinLength() + " characters";
            return state.retriesLeft()
                    ? ValidationOutcome.retry(CHECK_LENGTH, reason, RetryAction.RE_ENRICH)
                    : ValidationOutcome.failedSafe(CHECK_LENGTH, reason);
        }

        String qualityProblem = qualityProblem(text, state);
        if (qualityProblem != null) {
            return qualityFailure(qualityProblem, state);
        }
        return ValidationOutcome.passed();
    }

    private static ValidationOutcome qualityFailure(String reason, RequestState state) {
        return state.retriesLeft()
                ? ValidationOutcome.retry(CHECK_QUALITY, reason, RetryAction.ALTERNATE_STRATEGY)
                : ValidationOutcome.failedSafe(CHECK_QUALITY, reason);
    }

    String qualityProblem(String text, RequestState state) {
        String lower = text.toLowerCase(Locale.ROOT).strip();
        for (Pattern refusal : REFUSALS) {
            if (refusal.matcher(lower).find()) {
                return "refusal boilerplate";
            }
        }

        String query = normalize(state.userQuery());
        if (!query.isEmpty() && normalize(text).equals(query)) {
            return "answer repeats the question";
        }

        Set<String> words = new HashSet<>();
        Matcher matcher = WORD.matcher(lower);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        if (words.size() < properties.getValidation().getMinDistinctWords()) {
            return "too few distinct words";
        }

        Set<Long> known = new HashSet<>();
        EnrichedContext context = state.context();
        if (context != null) {
            for (RetrievalResult source : context.sources()) {
                known.add(source.id());
            }
        }
        for (Long cited : CitationExtractor.citedIds(text)) {
            if (!known.contains(cited)) {
                return "cites docId=" + cited + " which is not in the context";
            }
        }
        return null;
    }

    String safetyProblem(String text) {
        for (Pattern secret : SECRETS) {
            if (secret.matcher(text).find()) {
                return "answer contains a credential or personal identifier";
            }
        }
        for (Pattern leak : PROMPT_LEAKS) {
            if (leak.matcher(text).find()) {
                return "answer leaks system instructions";
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String term : properties.getValidation().getBlockedTerms()) {
            if (term != null && !term.isBlank() && lower.contains(term.toLowerCase(Locale.ROOT))) {
                return "answer contains blocked term";
            }
        }
        return null;
    }

    private static String normalize(String s) {
        if (s == null) {
            return "";
        }
        return s.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").strip();
    }
}
