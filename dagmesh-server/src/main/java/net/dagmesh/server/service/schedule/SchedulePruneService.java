/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import net.dagmesh.core.exception.InvariantViolationException;
import net.dagmesh.server.config.ScheduleConfiguration;
import net.dagmesh.server.config.ServerConfiguration;
import net.dagmesh.server.service.DagService;

@Component
@EnableAsync
public class SchedulePruneService {
    private static final Logger logger = LoggerFactory.getLogger(SchedulePruneService.class);

    @Autowired
    private DagService dagService;
    @Autowired
    private ScheduleConfiguration scheduleConfiguration;
    @Autowired
    ServerConfiguration serverConfiguration;

    @Async
    @Scheduled(fixedDelayString = "${service.schedule.prunerate:600000}")
    public void pruneService() {
        if (scheduleConfiguration.isPrune_active() && serverConfiguration.checkService()) {
            try {
                dagService.pruneOldNodes();
            } catch (InvariantViolationException e) {
                logger.error("pruning left the DAG inconsistent, stop accepting requests ", e);
                serverConfiguration.setServiceWait();
            } catch (Exception e) {
                logger.warn("pruneService ", e);
            }
        }
    }
}
