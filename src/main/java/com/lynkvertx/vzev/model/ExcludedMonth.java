package com.lynkvertx.vzev.model;

import lombok.Value;

import java.time.YearMonth;
import java.util.List;

@Value
public class ExcludedMonth {

    YearMonth month;
    List<String> reasons;
}
