package com.argument.mapping.argweave.service.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex check that a synthesized claim adds no facts of its own: every number
 * and every proper noun in it must already occur in the source premises.
 */
@Component
@Slf4j
public class HallucinationGuard {

    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern WORD = Pattern.compile("\\p{L}[\\p{L}'-]*");

    private static final Set<String> FUNCTION_WORDS = Set.of(
            "the", "a", "an", "this", "these", "that", "those", "it", "they", "we", "i");

    /**
     * @return a description of the new content, or empty when the claim is grounded
     */
    public Optional<String> findUngroundedContent(String claimText, List<String> premiseTexts) {
        String premises = String.join(" ", premiseTexts);

        Set<String> newNumbers = new TreeSet<>(findAll(NUMBER, claimText));
        newNumbers.removeAll(findAll(NUMBER, premises));
        if (!newNumbers.isEmpty()) {
            log.debug("Synthesized claim introduces numbers {}", newNumbers);
            return Optional.of("new numbers " + newNumbers);
        }

        Set<String> premiseWords = new HashSet<>();
        for (String word : findAll(WORD, premises)) {
            premiseWords.add(word.toLowerCase(Locale.ROOT));
        }
        Set<String> newProperNouns = new TreeSet<>();
        // every capitalized word, including the one opening the claim
        for (String candidate : findAll(WORD, claimText)) {
            if (!Character.isUpperCase(candidate.charAt(0))) {
                continue;
            }
            String lower = candidate.toLowerCase(Locale.ROOT);
            if (!FUNCTION_WORDS.contains(lower) && !premiseWords.contains(lower)) {
                newProperNouns.add(candidate);
            }
        }
        if (!newProperNouns.isEmpty()) {
            log.debug("Synthesized claim introduces proper nouns {}", newProperNouns);
            return Optional.of("new proper nouns " + newProperNouns);
        }
        return Optional.empty();
    }

    private List<String> findAll(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(text == null ? "" : text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }
}
