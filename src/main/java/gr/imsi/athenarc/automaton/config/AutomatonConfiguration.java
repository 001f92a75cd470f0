package gr.imsi.athenarc.automaton.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.automaton.nfa.Preset;

/**
 * Settings of a simulator run: which preset table to use and how tokens are separated.
 */
public class AutomatonConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(AutomatonConfiguration.class);

    public static final String PROPERTIES_RESOURCE = "/application.properties";
    public static final String PRESET_PROPERTY = "automaton.preset";
    public static final String SEPARATOR_PROPERTY = "automaton.token.separator";

    public static final Preset DEFAULT_PRESET = Preset.TEN_STATE;
    public static final String DEFAULT_SEPARATOR = "#";

    private final Preset preset;
    private final String tokenSeparator;

    private AutomatonConfiguration(Builder builder) {
        this.preset = builder.preset;
        this.tokenSeparator = builder.tokenSeparator;
    }

    public Preset getPreset() { return preset; }
    public String getTokenSeparator() { return tokenSeparator; }

    /**
     * Loads the configuration from {@code application.properties} on the classpath.
     * Defaults are used for missing keys or a missing file.
     */
    public static AutomatonConfiguration load() {
        Properties properties = new Properties();
        try (InputStream input = AutomatonConfiguration.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (input == null) {
                LOG.warn("Unable to find {} in resources, using defaults.", PROPERTIES_RESOURCE);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            LOG.warn("Failed to read " + PROPERTIES_RESOURCE + ", using defaults.", e);
        }
        return fromProperties(properties);
    }

    public static AutomatonConfiguration fromProperties(Properties properties) {
        Builder builder = new Builder();
        String preset = properties.getProperty(PRESET_PROPERTY);
        if (preset != null) {
            builder.preset(parsePreset(preset));
        }
        String separator = properties.getProperty(SEPARATOR_PROPERTY);
        if (separator != null) {
            builder.tokenSeparator(separator);
        }
        return builder.build();
    }

    public static Preset parsePreset(String value) {
        Preconditions.checkNotNull(value, "Preset name cannot be null");
        try {
            return Preset.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown preset: " + value + ". Supported presets are FIVE_STATE and TEN_STATE", e);
        }
    }

    public Builder toBuilder() {
        return new Builder().preset(preset).tokenSeparator(tokenSeparator);
    }

    @Override
    public String toString() {
        return "AutomatonConfiguration{preset=" + preset + ", tokenSeparator='" + tokenSeparator + "'}";
    }

    public static class Builder {
        private Preset preset = DEFAULT_PRESET;
        private String tokenSeparator = DEFAULT_SEPARATOR;

        public Builder preset(Preset preset) { this.preset = preset; return this; }
        public Builder tokenSeparator(String tokenSeparator) { this.tokenSeparator = tokenSeparator; return this; }

        public AutomatonConfiguration build() {
            Preconditions.checkNotNull(preset, "No preset specified.");
            Preconditions.checkArgument(tokenSeparator != null && !tokenSeparator.isEmpty(),
                "Token separator cannot be empty.");
            return new AutomatonConfiguration(this);
        }
    }
}
