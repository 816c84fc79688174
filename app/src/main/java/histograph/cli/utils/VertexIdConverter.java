package histograph.cli.utils;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import histograph.graph.VertexId;

/**
 * Converts command line arguments to unsigned 64-bit vertex ids.
 */
public class VertexIdConverter implements ITypeConverter<VertexId> {

    @Override
    public VertexId convert(String value) {
        try {
            return VertexId.parse(value);
        } catch (NumberFormatException e) {
            throw new TypeConversionException(
                    "'" + value + "' is not a vertex id (expected 0 to 18446744073709551615)");
        }
    }
}
