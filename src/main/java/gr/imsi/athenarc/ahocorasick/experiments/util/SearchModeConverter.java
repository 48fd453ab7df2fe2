package gr.imsi.athenarc.ahocorasick.experiments.util;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

public class SearchModeConverter implements IStringConverter<SearchMode> {
    @Override
    public SearchMode convert(String value) {
        try {
            return SearchMode.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ParameterException("Invalid -mode '" + value + "', expected one of match, threadsafe, contains, first, locate");
        }
    }
}
