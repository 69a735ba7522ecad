// file: server/src/main/java/io/monosync/server/dto/PushRequest.java
package io.monosync.server.dto;

import java.util.List;

/**
 * JSON body for POST /repos/{repo}/push.
 * Example:
 *   {
 *     "bookmark": "master",
 *     "commits": [
 *       {
 *         "parents": ["3f2a...e1"],
 *         "author": "alice",
 *         "date": 1700000000,
 *         "tzOffset": 0,
 *         "message": "add readme",
 *         "changes": { "README": { "contentBase64": "aGVsbG8=" } }
 *       },
 *       {
 *         "parents": ["#0"],
 *         "author": "alice",
 *         "date": 1700000060,
 *         "message": "rename",
 *         "changes": {
 *           "README": { "deleted": true },
 *           "README.md": { "contentBase64": "aGVsbG8=", "copyFrom": { "path": "README", "commit": "#0" } }
 *         }
 *       }
 *     ]
 *   }
 * Commits are ancestors first; "#i" names the i-th commit of the same request.
 */
public class PushRequest {
    public String bookmark;
    public List<CommitJson> commits;
}
