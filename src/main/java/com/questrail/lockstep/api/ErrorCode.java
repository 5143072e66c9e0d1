package com.questrail.lockstep.api;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * ErrorCode
 * -----------------------------------------------------------------------------
 * Closed taxonomy of domain failures shared by the reference model and the
 * system under test.
 *
 * <h2>Numeric tags</h2>
 * Every constant carries the numeric tag the contract fails with. The tag is the
 * only thing that survives the system's opaque error encoding, so the mapping
 * must stay one-to-one: two constants never share a tag.
 *
 * <p>Tags are grouped by concern:</p>
 * <ul>
 *   <li>1xx - authorization and call shape</li>
 *   <li>2xx - proposal and voting lifecycle</li>
 *   <li>3xx - token accounting</li>
 *   <li>4xx - custom entrypoints (registry / treasury variants)</li>
 * </ul>
 */
public enum ErrorCode
{
    NOT_ADMIN(100),
    NOT_PENDING_ADMIN(101),
    NOT_DELEGATE(102),
    FORBIDDEN_XTZ(103),
    NOT_GUARDIAN(104),

    FAIL_PROPOSAL_CHECK(200),
    PROPOSAL_NOT_EXIST(201),
    PROPOSAL_NOT_UNIQUE(202),
    MAX_PROPOSALS_REACHED(203),
    MAX_VOTERS_REACHED(204),
    NOT_PROPOSING_STAGE(205),
    VOTING_STAGE_OVER(206),
    EMPTY_FLUSH(207),
    DROP_PROPOSAL_CONDITION_NOT_MET(208),
    VOTER_DOES_NOT_EXIST(209),
    PROPOSER_NOT_EXIST_IN_LEDGER(210),

    NOT_ENOUGH_FROZEN_TOKENS(300),
    NOT_ENOUGH_STAKED_TOKENS(301),
    BAD_TOKEN_CONTRACT(302),
    NEGATIVE_TOTAL_SUPPLY(303),
    INSUFFICIENT_XTZ(304),

    UNPACKING_FAILED(400),
    MISSING_VALUE(401),
    UNEXPECTED_CUSTOM_PARAMETER(402);

    private static final Map<BigInteger, ErrorCode> BY_CODE;

    static {
        Map<BigInteger, ErrorCode> map = new HashMap<>();
        for (ErrorCode c : values()) {
            ErrorCode previous = map.put(c.code, c);
            if (previous != null) {
                throw new ExceptionInInitializerError(
                        "duplicate error tag " + c.code + ": " + previous + ", " + c);
            }
        }
        BY_CODE = Collections.unmodifiableMap(map);
    }

    private final BigInteger code;

    ErrorCode(long code) {
        this.code = BigInteger.valueOf(code);
    }

    /**
     * Returns the numeric tag the contract fails with.
     */
    public BigInteger code() {
        return code;
    }

    /**
     * Looks up the error with the given numeric tag.
     *
     * @return the error, or empty when the tag is not part of the taxonomy
     */
    public static Optional<ErrorCode> fromCode(BigInteger code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
