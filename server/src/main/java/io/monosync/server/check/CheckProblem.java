// file: server/src/main/java/io/monosync/server/check/CheckProblem.java
package io.monosync.server.check;

import io.monosync.core.ChangesetId;

public record CheckProblem(ProblemKind kind, ChangesetId changeset, String detail) {}
