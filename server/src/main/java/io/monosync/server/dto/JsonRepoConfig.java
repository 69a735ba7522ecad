// file: server/src/main/java/io/monosync/server/dto/JsonRepoConfig.java
package io.monosync.server.dto;

import java.util.List;
import java.util.Map;

/**
 * Jackson binding for the repository config file. Example:
 * <pre>
 * {
 *   "repos": [
 *     {"id": 0, "name": "large", "assignLegacyRevisions": true},
 *     {"id": 1, "name": "small"}
 *   ],
 *   "pushrebase": {"maxRetries": 10},
 *   "commitSync": [{
 *     "largeRepo": 0,
 *     "smallRepo": 1,
 *     "currentVersion": "v1",
 *     "versions": [{
 *       "version": "v1",
 *       "defaultPrefix": "small",
 *       "bookmarkPrefix": "small",
 *       "commonBookmarks": ["master"],
 *       "pathOverrides": {"tools": "infra/small-tools"},
 *       "emptyCommits": "skip"
 *     }]
 *   }]
 * }
 * </pre>
 */
public class JsonRepoConfig {
    public List<JsonRepo> repos;
    public JsonPushrebase pushrebase;
    public List<JsonCommitSync> commitSync;

    public static class JsonRepo {
        public int id;
        public String name;
        public boolean assignLegacyRevisions;
    }

    public static class JsonPushrebase {
        public int maxRetries = 10;
    }

    public static class JsonCommitSync {
        public int largeRepo;
        public int smallRepo;
        public String currentVersion;
        public List<JsonSyncVersion> versions;
    }

    public static class JsonSyncVersion {
        public String version;
        public String defaultPrefix;
        public String bookmarkPrefix;
        public List<String> commonBookmarks;
        public Map<String, String> pathOverrides;
        public String emptyCommits;
    }
}
