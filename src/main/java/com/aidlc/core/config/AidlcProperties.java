package com.aidlc.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "aidlc")
public class AidlcProperties {

    private String repoRoot = ".";
    private String recordsDir = ".ai-dlc";
    private String branchPrefix = "ai-dlc";
    private String worktreeRoot = "/tmp";
    private String pullRequestTitlePrefix = "AI-DLC";
    private Vcs vcs = new Vcs();
    private Defaults defaults = new Defaults();
    private Validation validation = new Validation();
    private Workflows workflows = new Workflows();

    public Path repoRootPath() {
        return Path.of(repoRoot).toAbsolutePath().normalize();
    }

    public Path recordsRootPath() {
        return repoRootPath().resolve(recordsDir).normalize();
    }

    public String getRepoRoot() { return repoRoot; }
    public void setRepoRoot(String repoRoot) { this.repoRoot = repoRoot; }

    public String getRecordsDir() { return recordsDir; }
    public void setRecordsDir(String recordsDir) { this.recordsDir = recordsDir; }

    public String getBranchPrefix() { return branchPrefix; }
    public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }

    public String getWorktreeRoot() { return worktreeRoot; }
    public void setWorktreeRoot(String worktreeRoot) { this.worktreeRoot = worktreeRoot; }

    public String getPullRequestTitlePrefix() { return pullRequestTitlePrefix; }
    public void setPullRequestTitlePrefix(String pullRequestTitlePrefix) { this.pullRequestTitlePrefix = pullRequestTitlePrefix; }

    public Vcs getVcs() { return vcs; }
    public void setVcs(Vcs vcs) { this.vcs = vcs; }

    public Defaults getDefaults() { return defaults; }
    public void setDefaults(Defaults defaults) { this.defaults = defaults; }

    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }

    public Workflows getWorkflows() { return workflows; }
    public void setWorkflows(Workflows workflows) { this.workflows = workflows; }

    public static class Vcs {
        /** {@code auto}, {@code git} or {@code jj}. */
        private String backend = "auto";
        private String remote = "origin";
        private int commandTimeoutSeconds = 120;

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }

        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }

        public int getCommandTimeoutSeconds() { return commandTimeoutSeconds; }
        public void setCommandTimeoutSeconds(int commandTimeoutSeconds) { this.commandTimeoutSeconds = commandTimeoutSeconds; }
    }

    /**
     * Built-in VCS defaults, the lowest layer of configuration precedence.
     */
    public static class Defaults {
        private String changeStrategy = "unit";
        private boolean elaborationReview = true;
        private String defaultBranch = "auto";
        private Boolean autoMerge;
        private Boolean autoSquash;

        public String getChangeStrategy() { return changeStrategy; }
        public void setChangeStrategy(String changeStrategy) { this.changeStrategy = changeStrategy; }

        public boolean isElaborationReview() { return elaborationReview; }
        public void setElaborationReview(boolean elaborationReview) { this.elaborationReview = elaborationReview; }

        public String getDefaultBranch() { return defaultBranch; }
        public void setDefaultBranch(String defaultBranch) { this.defaultBranch = defaultBranch; }

        public Boolean getAutoMerge() { return autoMerge; }
        public void setAutoMerge(Boolean autoMerge) { this.autoMerge = autoMerge; }

        public Boolean getAutoSquash() { return autoSquash; }
        public void setAutoSquash(Boolean autoSquash) { this.autoSquash = autoSquash; }
    }

    public static class Validation {
        private int timeoutSeconds = 300;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Workflows {
        private String defaultWorkflow = "default";
        private Map<String, Workflow> definitions = new LinkedHashMap<>(Map.of(
                "default", new Workflow("Standard elaborate, plan, build, review cycle",
                        List.of("elaborator", "planner", "builder", "reviewer"))));

        public String getDefaultWorkflow() { return defaultWorkflow; }
        public void setDefaultWorkflow(String defaultWorkflow) { this.defaultWorkflow = defaultWorkflow; }

        public Map<String, Workflow> getDefinitions() { return definitions; }
        public void setDefinitions(Map<String, Workflow> definitions) { this.definitions = definitions; }
    }

    public static class Workflow {
        private String description = "";
        private List<String> hats = List.of();

        public Workflow() {
        }

        public Workflow(String description, List<String> hats) {
            this.description = description;
            this.hats = hats;
        }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public List<String> getHats() { return hats; }
        public void setHats(List<String> hats) { this.hats = hats; }
    }
}
