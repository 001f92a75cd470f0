package gr.imsi.athenarc.automaton;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import gr.imsi.athenarc.automaton.config.AutomatonConfiguration;
import gr.imsi.athenarc.automaton.nfa.Preset;

public class PresetConverter implements IStringConverter<Preset> {
    @Override
    public Preset convert(String value) {
        try {
            return AutomatonConfiguration.parsePreset(value);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(e.getMessage());
        }
    }
}
