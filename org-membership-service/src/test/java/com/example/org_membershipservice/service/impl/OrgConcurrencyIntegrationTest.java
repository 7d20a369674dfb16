package com.example.org_membershipservice.service.impl;

import com.example.org_membershipservice.config.OrgProperties;
import com.example.org_membershipservice.dto.request.CreateOrgUnitRequest;
import com.example.org_membershipservice.dto.request.CreateRootUnitRequest;
import com.example.org_membershipservice.dto.request.SendInviteRequest;
import com.example.org_membershipservice.dto.response.OrgUnitResponse;
import com.example.org_membershipservice.entity.GlobalRole;
import com.example.org_membershipservice.entity.MembershipStatus;
import com.example.org_membershipservice.entity.OrgMembership;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.entity.User;
import com.example.org_membershipservice.entity.UserStatus;
import com.example.org_membershipservice.event.OrgAuditRecorder;
import com.example.org_membershipservice.exception.BaseException;
import com.example.org_membershipservice.policy.HierarchyPolicy;
import com.example.org_membershipservice.policy.SlugAllocator;
import com.example.org_membershipservice.repository.OrgMembershipRepository;
import com.example.org_membershipservice.repository.OrgUnitRepository;
import com.example.org_membershipservice.repository.UserRepository;
import com.example.org_membershipservice.security.CurrentActor;
import com.example.org_membershipservice.service.PermissionResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a real PostgreSQL with the Flyway schema, so the partial
 * unique indexes, check constraints and row locks are the ones production uses.
 *
 * Test transactions are disabled: every service call commits on its own and
 * concurrent calls really contend for the unit row lock.
 */
@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
    OrgUnitServiceImpl.class,
    OrgInviteServiceImpl.class,
    OrgMembershipServiceImpl.class,
    PermissionResolver.class,
    HierarchyPolicy.class,
    SlugAllocator.class,
    OrgAuditRecorder.class,
    OrgProperties.class
})
class OrgConcurrencyIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("orgdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", postgres::getDriverClassName);
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none");
    }

    @Autowired
    private OrgUnitServiceImpl unitService;
    @Autowired
    private OrgInviteServiceImpl inviteService;
    @Autowired
    private OrgMembershipServiceImpl membershipService;
    @Autowired
    private UserRepository userRepository;
    @Autowired
    private OrgUnitRepository unitRepository;
    @Autowired
    private OrgMembershipRepository membershipRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    private CurrentActor dev;
    private CurrentActor coordinatorA;
    private CurrentActor coordinatorB;
    private OrgUnitResponse root;
    private OrgUnitResponse ministry;

    @BeforeEach
    void setUp() {
        dev = CurrentActor.of(UUID.randomUUID(), GlobalRole.DEV);
        coordinatorA = CurrentActor.of(seedUser("Alice Andrade").getId());
        coordinatorB = CurrentActor.of(seedUser("Bruno Barros").getId());

        root = unitService.createRoot(dev, CreateRootUnitRequest.builder().name("Conselho").build());
        OrgUnitResponse executive = unitService.createChild(dev, root.getId(),
                CreateOrgUnitRequest.builder().name("Executiva").build());
        OrgUnitResponse sector = unitService.createChild(dev, executive.getId(),
                CreateOrgUnitRequest.builder()
                        .name("Setor Liturgia")
                        .coordinatorUserIds(List.of(coordinatorA.getUserId()))
                        .build());
        // A creates the ministry, so A and B are its only coordinators
        ministry = unitService.createChild(coordinatorA, sector.getId(),
                CreateOrgUnitRequest.builder()
                        .name("Ministerio de Leitores")
                        .coordinatorUserIds(List.of(coordinatorB.getUserId()))
                        .build());
    }

    @AfterEach
    void cleanUp() {
        jdbcTemplate.execute("TRUNCATE org_memberships, org_invites, org_units, users");
    }

    @Test
    void concurrentDemotionsOfTheLastTwoCoordinatorsLeaveOne() throws Exception {
        assertEquals(2, activeCoordinators(ministry.getId()));

        List<String> failures = runTogether(
                () -> membershipService.updateRole(coordinatorA, ministry.getId(),
                        coordinatorA.getUserId(), OrgRole.MEMBER),
                () -> {
                    membershipService.removeMember(coordinatorB, ministry.getId(), coordinatorB.getUserId());
                    return null;
                });

        assertEquals(List.of("LAST_COORDINATOR"), failures);
        assertEquals(1, activeCoordinators(ministry.getId()));
    }

    @Test
    void concurrentInvitesForTheSamePairLeaveOnePending() throws Exception {
        UUID inviteeId = seedUser("Carlos Costa").getId();
        SendInviteRequest request = SendInviteRequest.builder().userId(inviteeId).role(OrgRole.MEMBER).build();

        List<String> failures = runTogether(
                () -> inviteService.sendInvite(coordinatorA, ministry.getId(), request),
                () -> inviteService.sendInvite(coordinatorB, ministry.getId(), request));

        assertEquals(List.of("INVITE_EXISTS"), failures);
        Integer pending = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM org_invites WHERE org_unit_id = ? AND invited_user_id = ? AND status = 'PENDING'",
                Integer.class, ministry.getId(), inviteeId);
        assertEquals(1, pending);
    }

    @Test
    void concurrentRootCreationYieldsOneRoot() throws Exception {
        jdbcTemplate.update("UPDATE org_units SET is_active = FALSE");

        CurrentActor otherDev = CurrentActor.of(UUID.randomUUID(), GlobalRole.DEV);
        List<String> failures = runTogether(
                () -> unitService.createRoot(dev, CreateRootUnitRequest.builder().name("Novo Conselho").build()),
                () -> unitService.createRoot(otherDev, CreateRootUnitRequest.builder().name("Novo Conselho").build()));

        assertEquals(List.of("ALREADY_EXISTS"), failures);
        Integer activeRoots = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM org_units WHERE parent_id IS NULL AND is_active", Integer.class);
        assertEquals(1, activeRoots);
    }

    @Test
    void partialIndexRejectsSecondActiveMembership() {
        OrgMembership duplicate = OrgMembership.builder()
                .userId(coordinatorB.getUserId())
                .orgUnitId(ministry.getId())
                .role(OrgRole.MEMBER)
                .build();

        assertThrows(DataIntegrityViolationException.class, () -> membershipRepository.saveAndFlush(duplicate));
    }

    @Test
    void removedMembershipsDoNotBlockRejoining() {
        membershipService.updateRole(coordinatorA, ministry.getId(), coordinatorB.getUserId(), OrgRole.MEMBER);
        membershipService.removeMember(coordinatorA, ministry.getId(), coordinatorB.getUserId());

        membershipRepository.saveAndFlush(OrgMembership.builder()
                .userId(coordinatorB.getUserId())
                .orgUnitId(ministry.getId())
                .role(OrgRole.MEMBER)
                .build());

        assertTrue(membershipRepository.existsByOrgUnitIdAndUserIdAndStatus(
                ministry.getId(), coordinatorB.getUserId(), MembershipStatus.ACTIVE));
    }

    @Test
    void checkConstraintRejectsGroupWithoutSubtype() {
        OrgUnit group = OrgUnit.builder()
                .type(OrgUnitType.GROUP)
                .name("Grupo sem tipo")
                .slug("grupo-sem-tipo")
                .parentId(ministry.getId())
                .createdBy(coordinatorA.getUserId())
                .build();

        assertThrows(DataIntegrityViolationException.class, () -> unitRepository.saveAndFlush(group));
    }

    @Test
    void partialIndexRejectsSecondActiveRoot() {
        OrgUnit secondRoot = OrgUnit.builder()
                .type(OrgUnitType.COUNCIL)
                .name("Outro Conselho")
                .slug("outro-conselho")
                .createdBy(dev.getUserId())
                .build();

        assertThrows(DataIntegrityViolationException.class, () -> unitRepository.saveAndFlush(secondRoot));
    }

    /**
     * Starts both calls at the same instant and returns the business error
     * codes of the calls that failed.
     */
    private List<String> runTogether(Callable<?> first, Callable<?> second) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (Callable<?> call : List.of(first, second)) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    start.await();
                    try {
                        call.call();
                        return null;
                    } catch (BaseException e) {
                        return e.getCode();
                    }
                }));
            }
            assertTrue(ready.await(10, TimeUnit.SECONDS));
            start.countDown();

            List<String> failures = new ArrayList<>();
            for (Future<String> future : futures) {
                String code = future.get(30, TimeUnit.SECONDS);
                if (code != null) {
                    failures.add(code);
                }
            }
            return failures;
        } finally {
            executor.shutdownNow();
        }
    }

    private long activeCoordinators(UUID unitId) {
        return membershipRepository.countByOrgUnitIdAndRoleAndStatus(unitId, OrgRole.COORDINATOR, MembershipStatus.ACTIVE);
    }

    private User seedUser(String fullName) {
        UUID id = UUID.randomUUID();
        return userRepository.saveAndFlush(User.builder()
                .id(id)
                .email(id + "@example.com")
                .fullName(fullName)
                .status(UserStatus.ACTIVE)
                .build());
    }
}
