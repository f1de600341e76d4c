package com.lynkvertx.vzev.model;

import lombok.Value;

import java.util.List;

/**
 * Validated settings and member/meter graph of one collective.
 */
@Value
public class CollectiveGraph {

    CollectiveSettings settings;
    List<MemberInfo> members;
}
