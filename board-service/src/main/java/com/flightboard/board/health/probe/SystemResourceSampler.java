package com.flightboard.board.health.probe;

import java.io.IOException;

public interface SystemResourceSampler {

    /**
     * Takes one sample. May block for the CPU sampling window.
     */
    SystemResourceSample sample() throws IOException, InterruptedException;
}
