package com.phillippitts.voicebridge.domain;

/**
 * Outcome of a claim together with the token the winner must present when submitting.
 *
 * @param outcome    claim outcome
 * @param claimToken token minted for the winner; null unless {@code outcome} is SUCCESS
 * @param language   language of the claimed request; null unless SUCCESS
 */
public record ClaimResult(ClaimOutcome outcome, String claimToken, String language) {

    public static ClaimResult success(String claimToken, String language) {
        return new ClaimResult(ClaimOutcome.SUCCESS, claimToken, language);
    }

    public static ClaimResult rejected(ClaimOutcome outcome) {
        if (outcome == ClaimOutcome.SUCCESS) {
            throw new IllegalArgumentException("Rejected claim cannot have outcome SUCCESS");
        }
        return new ClaimResult(outcome, null, null);
    }

    public boolean isSuccess() {
        return outcome == ClaimOutcome.SUCCESS;
    }
}
