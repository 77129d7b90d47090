package tech.yump.configserver.interpolation;

/**
 * A placeholder token found in a manifest scalar, e.g. {@code ((db_password))} or
 * {@code ((!db_password))}.
 *
 * @param token     the full scalar text, wrapper and marker included.
 * @param name      the inner name with the wrapper and marker stripped.
 * @param doNotTrack whether the token carried the {@code !} marker.
 */
public record Placeholder(String token, String name, boolean doNotTrack) {
}
