// file: server/src/main/java/io/monosync/server/dto/CommitJson.java
package io.monosync.server.dto;

import java.util.List;
import java.util.Map;

/** One commit of a push. Dates are Unix seconds; tzOffset is seconds west of UTC. */
public class CommitJson {
    public List<String> parents;
    public String author;
    public long date;
    public int tzOffset;
    public String message;
    public Map<String, String> extras; // values are UTF-8 text
    public Map<String, ChangeJson> changes;
}
