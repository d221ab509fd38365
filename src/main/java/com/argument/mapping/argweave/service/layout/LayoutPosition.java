package com.argument.mapping.argweave.service.layout;

import lombok.Value;

@Value
public class LayoutPosition {
    double x;
    double y;
}
