package com.hmmtagger.server.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads tagged sentences, one per line, written as whitespace separated
 * {@code observation/STATE} tokens:
 *
 * <pre>
 * # comment
 * killer/N clown/N
 * crazy/A problem/N
 * </pre>
 *
 * The state is whatever follows the last slash, so observations may contain
 * slashes themselves.
 */
public class TaggedCorpusReader {
    private static final Logger logger = LoggerFactory.getLogger(TaggedCorpusReader.class);
    private static final char SEPARATOR = '/';

    public TaggedCorpus read(InputStream in) throws IOException {
        return read(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public TaggedCorpus read(Reader source) throws IOException {
        List<List<LabeledObservation>> sequences = new ArrayList<>();
        Set<State> states = new LinkedHashSet<>();
        Set<Observation> observations = new LinkedHashSet<>();

        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#"))
                    continue;

                List<LabeledObservation> sequence = parseLine(trimmed, lineNumber);
                for (LabeledObservation token : sequence) {
                    states.add(token.getState());
                    observations.add(token.getObservation());
                }
                sequences.add(sequence);
            }
        }

        logger.info("Read {} tagged sequences ({} states, {} observations)", sequences.size(), states.size(),
                observations.size());
        return new TaggedCorpus(sequences, new ArrayList<>(states), new ArrayList<>(observations));
    }

    public static List<LabeledObservation> parseLine(String line, int lineNumber) {
        List<LabeledObservation> sequence = new ArrayList<>();
        for (String token : line.trim().split("\\s+")) {
            int slash = token.lastIndexOf(SEPARATOR);
            if (slash <= 0 || slash == token.length() - 1) {
                throw new IllegalArgumentException(
                        "Malformed token '" + token + "' on line " + lineNumber + ", expected observation/STATE");
            }
            Observation observation = Observation.of(token.substring(0, slash));
            State state = State.of(token.substring(slash + 1));
            sequence.add(observation.as(state));
        }
        return sequence;
    }

    /**
     * Renders a tagged sequence in the same format the reader accepts.
     */
    public static String format(List<LabeledObservation> sequence) {
        StringBuilder sb = new StringBuilder();
        for (LabeledObservation token : sequence) {
            if (sb.length() > 0)
                sb.append(' ');
            sb.append(token);
        }
        return sb.toString();
    }
}
