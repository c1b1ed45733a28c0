package com.aidlc.core.config;

import com.aidlc.core.model.Intent;
import com.aidlc.core.model.VcsConfig;
import com.aidlc.core.model.VcsOverrides;
import com.aidlc.core.store.FrontmatterDocument;
import com.aidlc.core.store.IntentStore;
import com.aidlc.core.store.VcsOverridesMapper;
import com.aidlc.vcs.VcsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves the effective {@link VcsConfig} for an intent. Precedence, highest first: the intent's
 * own {@code vcs} frontmatter block, the repository's {@code settings.yml}, then the
 * {@code aidlc.defaults.*} properties. A default branch of {@code auto} is detected through the
 * VCS client.
 */
public class VcsConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(VcsConfigResolver.class);

    static final String SETTINGS_FILE = "settings.yml";
    static final String AUTO = "auto";

    private final IntentStore intentStore;
    private final VcsClient vcs;
    private final AidlcProperties.Defaults defaults;
    private final Path settingsFile;

    public VcsConfigResolver(IntentStore intentStore, VcsClient vcs, AidlcProperties properties) {
        this.intentStore = intentStore;
        this.vcs = vcs;
        this.defaults = properties.getDefaults();
        this.settingsFile = properties.recordsRootPath().resolve(SETTINGS_FILE);
    }

    /**
     * Configuration for {@code intentId}. An unknown intent resolves to the repository configuration.
     */
    public VcsConfig resolve(String intentId) {
        VcsOverrides intentLayer = intentStore.loadIntent(intentId)
                .map(Intent::vcsOverrides)
                .orElse(VcsOverrides.NONE);
        return toConfig(intentLayer.over(repositorySettings()));
    }

    /**
     * Configuration without any intent-level overrides.
     */
    public VcsConfig resolveRepository() {
        return toConfig(repositorySettings());
    }

    VcsOverrides repositorySettings() {
        if (!Files.isRegularFile(settingsFile)) {
            return VcsOverrides.NONE;
        }
        String yaml;
        try {
            yaml = Files.readString(settingsFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + settingsFile, e);
        }
        Object block = FrontmatterDocument.readYaml(yaml).get(VcsOverridesMapper.BLOCK_KEY);
        if (block instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> typed = (Map<String, Object>) map;
            return VcsOverridesMapper.fromMap(typed);
        }
        if (block != null) {
            log.warn("Ignoring non-mapping '{}' block in {}", VcsOverridesMapper.BLOCK_KEY, settingsFile);
        }
        return VcsOverrides.NONE;
    }

    private VcsConfig toConfig(VcsOverrides layered) {
        VcsOverrides merged = layered.over(new VcsOverrides(
                defaults.getChangeStrategy(),
                defaults.isElaborationReview(),
                defaults.getDefaultBranch(),
                defaults.getAutoMerge(),
                defaults.getAutoSquash()));

        String branch = merged.defaultBranch();
        if (branch == null || AUTO.equalsIgnoreCase(branch)) {
            branch = vcs.detectDefaultBranch();
            log.debug("Detected default branch {}", branch);
        }
        return new VcsConfig(merged.changeStrategy(), merged.elaborationReview(), branch,
                merged.autoMerge(), merged.autoSquash());
    }
}
