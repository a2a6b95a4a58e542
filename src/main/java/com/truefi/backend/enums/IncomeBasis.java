package com.truefi.backend.enums;

public enum IncomeBasis {
    GROSS,
    NET
}
