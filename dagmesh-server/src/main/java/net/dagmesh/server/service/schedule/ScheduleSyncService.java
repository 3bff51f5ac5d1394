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

import net.dagmesh.server.config.ScheduleConfiguration;
import net.dagmesh.server.config.ServerConfiguration;
import net.dagmesh.server.service.SyncService;

@Component
@EnableAsync
public class ScheduleSyncService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleSyncService.class);

    @Autowired
    private ScheduleConfiguration scheduleConfiguration;
    @Autowired
    private SyncService syncService;
    @Autowired
    ServerConfiguration serverConfiguration;

    /*
     * Full reconciliation pass with the peers
     */
    @Async
    @Scheduled(fixedDelayString = "${service.schedule.syncrate:300000}")
    public void syncService() {
        if (scheduleConfiguration.isSync_active() && serverConfiguration.checkService()) {
            try {
                logger.debug(" Start syncWithNetwork: ");
                syncService.syncWithNetwork();
            } catch (Exception e) {
                logger.warn("syncService ", e);
            }
        }
    }

    @Async
    @Scheduled(fixedDelayString = "${service.schedule.sessionrate:1000}")
    public void monitorSessions() {
        if (scheduleConfiguration.isSync_active() && serverConfiguration.checkService()) {
            try {
                syncService.monitorSessions();
            } catch (Exception e) {
                logger.warn("monitorSessions ", e);
            }
        }
    }
}
