package com.jobportal.api.dashboard;

import com.jobportal.api.security.SecurityActor;
import com.jobportal.application.dashboard.DashboardAggregator;
import com.jobportal.application.dashboard.EmployerDashboard;
import com.jobportal.application.dashboard.JobseekerDashboard;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/dashboard")
public class DashboardController {

    private final DashboardAggregator dashboards;

    public DashboardController(DashboardAggregator dashboards) {
        this.dashboards = dashboards;
    }

    @GetMapping("/jobseeker")
    public JobseekerDashboard jobseeker() {
        return dashboards.jobseekerDashboard(SecurityActor.current());
    }

    @GetMapping("/employer")
    public EmployerDashboard employer() {
        return dashboards.employerDashboard(SecurityActor.current());
    }
}
