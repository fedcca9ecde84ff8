package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryRules(
    @JsonProperty("per_item_delivery") Delivery perItemDelivery,
    @JsonProperty("per_group_delivery") Delivery perGroupDelivery,
    @JsonProperty("summary_delivery") Delivery summaryDelivery,
    @JsonProperty("multiple_destinations") List<Delivery> multipleDestinations,
    @JsonProperty("send_when_no_results") Boolean sendWhenNoResults
) implements Serializable {

    public DeliveryRules {
        multipleDestinations = Defaults.list(multipleDestinations);
    }

    public List<Delivery> allDeliveries() {
        List<Delivery> all = new ArrayList<>();
        if (perItemDelivery != null) {
            all.add(perItemDelivery);
        }
        if (perGroupDelivery != null) {
            all.add(perGroupDelivery);
        }
        if (summaryDelivery != null) {
            all.add(summaryDelivery);
        }
        all.addAll(multipleDestinations);
        return all;
    }

    public boolean sendsWhenEmpty() {
        return Boolean.TRUE.equals(sendWhenNoResults);
    }
}
