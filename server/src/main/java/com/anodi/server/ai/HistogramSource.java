package com.anodi.server.ai;

public interface HistogramSource {

    // Identifies the histogram parameters, e.g. "n=2;f=1,2;tie=ZERO"
    String getSignature();

    MultiResolutionHistogram compute(BinaryImage image);
}
