// file: server/src/main/java/io/monosync/server/check/CheckReport.java
package io.monosync.server.check;

import java.util.List;

/**
 * @param checked number of distinct changesets visited
 */
public record CheckReport(String repo, int checked, List<CheckProblem> problems) {
    public CheckReport {
        problems = List.copyOf(problems);
    }

    public boolean ok() {
        return problems.isEmpty();
    }
}
