package com.example.series_backend.service.handler;

import com.example.series_backend.dto.ClaimedJob;
import com.example.series_backend.util.JobType;

/**
 * Executes one claimed production job. Throwing marks the attempt as failed.
 */
public interface ProductionJobHandler {

    JobType handlesType();

    void execute(ClaimedJob job);
}
