package tech.yump.configserver.mapping;

/**
 * Persistence target for placeholder mappings.
 * Each call stores one independent record; duplicates are acceptable.
 */
public interface PlaceholderMappingBackend {

    /**
     * @param mapping the mapping to store. Must not be null.
     * @throws PlaceholderMappingException if the mapping could not be stored.
     */
    void save(PlaceholderMapping mapping) throws PlaceholderMappingException;
}
