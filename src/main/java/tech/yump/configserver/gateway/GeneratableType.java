package tech.yump.configserver.gateway;

import java.util.Arrays;
import java.util.Optional;

/**
 * Value types the config server can generate on demand.
 */
public enum GeneratableType {
    PASSWORD("password"),
    CERTIFICATE("certificate");

    private final String typeName;

    GeneratableType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * @param typeName property type as declared by a job, e.g. {@code password}; may be null.
     * @return the matching generatable type, or empty if the type cannot be generated.
     */
    public static Optional<GeneratableType> fromTypeName(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.typeName.equals(typeName))
                .findFirst();
    }
}
