package com.di.modelnova.lifecycle.abtest;

import lombok.Value;

@Value
public class ArmAssignment {
    String testId;
    Arm arm;
    String versionId;
    /** True when the caller identity decided the arm; false for a random draw. */
    boolean sticky;
}
