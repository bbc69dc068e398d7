package ai.storygen.chapters.cli;

import ai.storygen.chapters.config.InputFormat;
import picocli.CommandLine;

public class InputFormatConverter implements CommandLine.ITypeConverter<InputFormat> {
    @Override
    public InputFormat convert(String value) {
        if (value == null || value.isBlank()) {
            throw new CommandLine.TypeConversionException("Input format must not be blank");
        }
        try {
            return InputFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
