package tech.yump.configserver.interpolation;

import java.util.List;

/**
 * Extra input for values the config server generates.
 *
 * @param dnsRecordNames names a generated certificate must cover; the first one becomes the common name.
 */
public record GenerationOptions(List<String> dnsRecordNames) {

    public GenerationOptions {
        dnsRecordNames = dnsRecordNames == null ? List.of() : List.copyOf(dnsRecordNames);
    }

    public static GenerationOptions none() {
        return new GenerationOptions(List.of());
    }
}
