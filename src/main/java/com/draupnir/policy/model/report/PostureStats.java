package com.draupnir.policy.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Corpus-wide counters of a posture scan. Counters only ever go up.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostureStats {

    @JsonProperty("total")
    private int total;

    @JsonProperty("cnp")
    private int cnpCount;

    @JsonProperty("ccnp")
    private int ccnpCount;

    @JsonProperty("with_l7")
    private int withL7Count;

    @JsonProperty("dns_ok")
    private int dnsOkCount;

    public void incrementTotal() {
        total++;
    }

    public void incrementCnp() {
        cnpCount++;
    }

    public void incrementCcnp() {
        ccnpCount++;
    }

    public void incrementWithL7() {
        withL7Count++;
    }

    public void incrementDnsOk() {
        dnsOkCount++;
    }
}
