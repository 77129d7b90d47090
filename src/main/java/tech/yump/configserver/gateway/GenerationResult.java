package tech.yump.configserver.gateway;

/**
 * Outcome of asking the config server to generate a value.
 */
public sealed interface GenerationResult permits GenerationResult.Success, GenerationResult.Error {

    record Success(String name) implements GenerationResult {
    }

    record Error(String name, String detail) implements GenerationResult {
    }
}
