// file: server/src/main/java/io/monosync/server/dto/LookupResponse.java
package io.monosync.server.dto;

import java.util.Map;

/**
 * JSON response for GET /repos/{repo}/lookup.
 *   {
 *     "repo": "large",
 *     "changeset": "9c1e...",
 *     "identifiers": { "native": "9c1e...", "legacy": "12", "alt": "0d4b..." }
 *   }
 * Schemes that do not name the commit are left out.
 */
public class LookupResponse {
    public String repo;
    public String changeset;
    public Map<String, String> identifiers;
}
