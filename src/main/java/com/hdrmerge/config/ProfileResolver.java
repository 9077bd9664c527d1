package com.hdrmerge.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the RAW conversion profile for a folder: the explicitly requested one, else the first
 * profile whose folder key occurs in the folder name, else the default, else the first profile.
 */
public final class ProfileResolver {

    private final List<ProcessingProfile> profiles;

    public ProfileResolver(List<ProcessingProfile> profiles) {
        this.profiles = List.copyOf(profiles);
    }

    public Optional<ProcessingProfile> resolve(Path folder, String requestedName) {
        if (profiles.isEmpty()) {
            return Optional.empty();
        }
        if (requestedName != null && !requestedName.isBlank()) {
            for (ProcessingProfile profile : profiles) {
                if (profile.name().equals(requestedName)) {
                    return Optional.of(profile);
                }
            }
        }

        String folderName = folder == null || folder.getFileName() == null
            ? ""
            : folder.getFileName().toString().toLowerCase(Locale.ROOT);
        for (ProcessingProfile profile : profiles) {
            String key = profile.folderKey().toLowerCase(Locale.ROOT);
            if (!key.isEmpty() && folderName.contains(key)) {
                return Optional.of(profile);
            }
        }

        for (ProcessingProfile profile : profiles) {
            if (profile.isDefault()) {
                return Optional.of(profile);
            }
        }
        return Optional.of(profiles.get(0));
    }
}
