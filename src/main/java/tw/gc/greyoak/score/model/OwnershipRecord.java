package tw.gc.greyoak.score.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Shareholding pattern. Holdings are percentages, the pledge is a fraction of promoter holding.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OwnershipRecord {
    Double promoterHoldPct;
    Double promoterPledgeFrac;
    Double fiiHoldPct;
    Double diiHoldPct;
    Double fiiDiiDeltaPp;   // quarter-on-quarter change in FII+DII, percentage points
}
