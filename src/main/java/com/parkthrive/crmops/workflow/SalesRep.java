package com.parkthrive.crmops.workflow;

import lombok.Value;

@Value
public class SalesRep {
    String name;
    String userId;
}
