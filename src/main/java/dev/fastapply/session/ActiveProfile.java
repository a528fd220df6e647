package dev.fastapply.session;

/**
 * Profile selected in the profile picker.
 */
public record ActiveProfile(String profileId, String profileName) {
}
