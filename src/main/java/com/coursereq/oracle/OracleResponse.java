package com.coursereq.oracle;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What the oracle produced for one course: a candidate record, a refusal with a reason, or a
 * verdict that the source text is too ambiguous to translate.
 */
public record OracleResponse(Kind kind, JsonNode candidate, String reason) {

    public enum Kind { CANDIDATE, FAILURE, AMBIGUOUS }

    public static OracleResponse candidate(JsonNode candidate) {
        return new OracleResponse(Kind.CANDIDATE, candidate, null);
    }

    public static OracleResponse failure(String reason) {
        return new OracleResponse(Kind.FAILURE, null, reason);
    }

    public static OracleResponse ambiguous(String reason) {
        return new OracleResponse(Kind.AMBIGUOUS, null, reason);
    }
}
