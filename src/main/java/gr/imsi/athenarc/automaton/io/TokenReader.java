package gr.imsi.athenarc.automaton.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Splits input text into tokens on a fixed separator.
 * Tokens are trimmed and blank ones are dropped.
 */
public class TokenReader {

    private static final Logger LOG = LoggerFactory.getLogger(TokenReader.class);

    private final Splitter splitter;

    public TokenReader(String separator) {
        Preconditions.checkArgument(separator != null && !separator.isEmpty(), "Token separator cannot be empty");
        this.splitter = Splitter.on(separator).trimResults().omitEmptyStrings();
    }

    public List<String> split(String content) {
        return ImmutableList.copyOf(splitter.split(content));
    }

    /**
     * Reads all tokens of a file.
     *
     * @return the tokens, empty if the file does not exist, cannot be read or has no tokens
     */
    public List<String> read(Path file) {
        if (!Files.isRegularFile(file)) {
            LOG.warn("Input file not found: {}", file);
            return ImmutableList.of();
        }
        try {
            List<String> tokens = split(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            LOG.info("Read {} tokens from {}", tokens.size(), file);
            return tokens;
        } catch (IOException e) {
            LOG.warn("Failed to read input file: " + file, e);
            return ImmutableList.of();
        }
    }
}
