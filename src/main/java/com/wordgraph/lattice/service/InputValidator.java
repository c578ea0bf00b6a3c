package com.wordgraph.lattice.service;

import com.wordgraph.lattice.config.LatticeSettings;
import com.wordgraph.lattice.dto.RejectedRecord;
import com.wordgraph.lattice.exception.MalformedInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes raw word records and refuses the ones a lattice cannot hold.
 *
 * Records are trimmed and, when configured, lower-cased with Locale.ROOT. A record is
 * malformed if it is null or empty after trimming, or contains whitespace, a control
 * character, or one of the reserved characters.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InputValidator {

    private final LatticeSettings settings;

    /**
     * @param records  raw word records in submission order
     * @param failFast throw on the first malformed record instead of skipping it
     * @throws MalformedInputException on a malformed record in fail-fast mode, or if no valid word remains
     */
    public ValidatedInput validate(List<String> records, boolean failFast) {
        Set<String> words = new LinkedHashSet<>();
        List<RejectedRecord> rejected = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            String raw = records.get(i);
            String reason = rejectionReason(raw);
            if (reason != null) {
                RejectedRecord record = RejectedRecord.builder()
                        .index(i)
                        .value(raw)
                        .reason(reason)
                        .build();
                if (failFast) {
                    throw new MalformedInputException("Malformed record at index " + i + ": " + reason, List.of(record));
                }
                log.warn("Skipping malformed record {} ('{}'): {}", i, raw, reason);
                rejected.add(record);
                continue;
            }
            words.add(normalize(raw));
        }

        if (words.isEmpty()) {
            throw new MalformedInputException("No valid words to build a lattice from", rejected);
        }

        log.debug("Validated {} records: {} distinct words, {} rejected", records.size(), words.size(), rejected.size());
        return new ValidatedInput(records.size(), List.copyOf(words), List.copyOf(rejected));
    }

    private String rejectionReason(String raw) {
        if (raw == null) {
            return "word is null";
        }
        String word = raw.trim();
        if (word.isEmpty()) {
            return "word is empty";
        }
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isWhitespace(c)) {
                return "embedded whitespace at position " + i;
            }
            if (Character.isISOControl(c)) {
                return "control character at position " + i;
            }
            if (settings.getReservedCharacters().indexOf(c) >= 0) {
                return "reserved character '" + c + "' at position " + i;
            }
        }
        return null;
    }

    private String normalize(String raw) {
        String word = raw.trim();
        return settings.isLowercaseInput() ? word.toLowerCase(Locale.ROOT) : word;
    }
}
