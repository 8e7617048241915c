package com.example.billingautomation.service.notification;

import com.example.billingautomation.client.ClientModels.UserAccount;
import com.example.billingautomation.client.PropertyApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Looks up the managers who receive summaries and escalations
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManagerDirectoryService {

    static final String MANAGER_ROLE = "manager";

    private final PropertyApiClient propertyApiClient;

    public List<UserAccount> listManagers() {
        var managers = propertyApiClient.getUsersByRole(MANAGER_ROLE);
        log.debug("Found {} managers", managers.size());
        return managers;
    }
}
