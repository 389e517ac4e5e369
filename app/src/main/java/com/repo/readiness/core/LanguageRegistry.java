package com.repo.readiness.core;

import com.repo.readiness.languages.*;

import java.util.*;

/**
 * Registry for language profiles.
 * Routes files to the appropriate profile based on extension.
 */
public class LanguageRegistry {

    private final List<LanguageProfile> profiles;
    private final Map<String, LanguageProfile> extensionMap;
    private final LanguageProfile fallbackProfile;

    public LanguageRegistry(List<LanguageProfile> profiles, LanguageProfile fallbackProfile) {
        this.profiles = new ArrayList<>(profiles);
        this.fallbackProfile = fallbackProfile;
        this.extensionMap = buildExtensionMap();
    }

    /**
     * Registry with every built-in profile and the generic fallback.
     */
    public static LanguageRegistry defaults() {
        return new LanguageRegistry(
                List.of(new CSharpProfile(), new JavaProfile(), new JavaScriptProfile(),
                        new PythonProfile(), new GoProfile()),
                new GenericProfile());
    }

    private Map<String, LanguageProfile> buildExtensionMap() {
        Map<String, LanguageProfile> map = new HashMap<>();

        // Sort by priority (lower = higher priority)
        List<LanguageProfile> sorted = new ArrayList<>(profiles);
        sorted.sort(Comparator.comparingInt(LanguageProfile::getPriority));

        // First profile wins for each extension
        for (LanguageProfile profile : sorted) {
            for (String ext : profile.getSupportedExtensions()) {
                map.putIfAbsent(ext, profile);
            }
        }

        return map;
    }

    /**
     * Get the profile for an extension (".java"), falling back to the generic profile.
     */
    public LanguageProfile getProfile(String extension) {
        return extensionMap.getOrDefault(extension.toLowerCase(Locale.ROOT), fallbackProfile);
    }

    public LanguageProfile getProfile(SourceFile file) {
        return getProfile(file.extension());
    }

    public LanguageProfile getFallbackProfile() {
        return fallbackProfile;
    }

    /**
     * Get all extensions with a dedicated profile.
     */
    public Set<String> getSupportedExtensions() {
        return Collections.unmodifiableSet(extensionMap.keySet());
    }
}
