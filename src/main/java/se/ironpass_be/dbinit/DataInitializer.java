package se.ironpass_be.dbinit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import se.ironpass_be.pojo.MembershipPlan;
import se.ironpass_be.pojo.StaffUser;
import se.ironpass_be.pojo.enums.StaffRole;
import se.ironpass_be.repository.MembershipPlanRepository;
import se.ironpass_be.repository.StaffUserRepository;
import se.ironpass_be.service.SettingsService;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Component
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final SettingsService settingsService;
    private final StaffUserRepository staffUserRepository;
    private final MembershipPlanRepository membershipPlanRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${gym.bootstrap.admin-email:admin@ironpass.local}")
    private String adminEmail;

    @Value("${gym.bootstrap.admin-password:changeme}")
    private String adminPassword;

    @Value("${gym.bootstrap.sample-plans:true}")
    private boolean samplePlans;

    public DataInitializer(SettingsService settingsService,
                           StaffUserRepository staffUserRepository,
                           MembershipPlanRepository membershipPlanRepository,
                           PasswordEncoder passwordEncoder) {
        this.settingsService = settingsService;
        this.staffUserRepository = staffUserRepository;
        this.membershipPlanRepository = membershipPlanRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public void run(String... args) {
        initSettings();
        initAdmin();
        initPlans();
    }

    private void initSettings() {
        int created = settingsService.seedDefaultSettings();
        if (created > 0) {
            log.info("Seeded {} default gym settings", created);
        }
    }

    private void initAdmin() {
        if (staffUserRepository.count() > 0) {
            return;
        }
        staffUserRepository.save(StaffUser.builder()
                .email(adminEmail)
                .passwordHash(passwordEncoder.encode(adminPassword))
                .name("Administrator")
                .role(StaffRole.ADMIN)
                .build());
        log.info("Default admin staff user {} has been created, change its password", adminEmail);
    }

    private void initPlans() {
        if (!samplePlans || membershipPlanRepository.count() > 0) {
            return;
        }
        List<MembershipPlan> plans = new ArrayList<>();
        plans.add(plan("Monthly", "Unlimited access for 30 days", "100000", 30));
        plans.add(plan("Quarterly", "Unlimited access for 90 days", "270000", 90));
        plans.add(plan("Yearly", "Unlimited access for 365 days", "960000", 365));
        membershipPlanRepository.saveAll(plans);
        log.info("Default membership plans have been created");
    }

    private MembershipPlan plan(String name, String description, String price, int durationDays) {
        return MembershipPlan.builder()
                .name(name)
                .description(description)
                .price(new BigDecimal(price))
                .durationDays(durationDays)
                .build();
    }
}
