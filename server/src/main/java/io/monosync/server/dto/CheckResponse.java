// file: server/src/main/java/io/monosync/server/dto/CheckResponse.java
package io.monosync.server.dto;

import java.util.List;

public class CheckResponse {
    public String repo;
    public int checked;
    public boolean ok;
    public List<Problem> problems;

    public static class Problem {
        public String kind;
        public String changeset;
        public String detail;
    }
}
