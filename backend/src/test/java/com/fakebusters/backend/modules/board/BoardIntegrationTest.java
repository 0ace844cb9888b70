package com.fakebusters.backend.modules.board;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.fakebusters.backend.global.common.time.TimeConfig;
import com.fakebusters.backend.global.config.JpaConfig;
import com.fakebusters.backend.global.error.CommandValidator;
import com.fakebusters.backend.global.error.ProblemException;
import com.fakebusters.backend.global.error.ValidationProblemException;
import com.fakebusters.backend.modules.audit.application.AuditLogService;
import com.fakebusters.backend.modules.audit.domain.AuditLog;
import com.fakebusters.backend.modules.audit.infrastructure.AuditLogRepository;
import com.fakebusters.backend.modules.auth.domain.UserAccount;
import com.fakebusters.backend.modules.board.application.ApproveJoinRequestCommand;
import com.fakebusters.backend.modules.board.application.BoardAttributes;
import com.fakebusters.backend.modules.board.application.BoardMemberService;
import com.fakebusters.backend.modules.board.application.BoardPatch;
import com.fakebusters.backend.modules.board.application.BoardService;
import com.fakebusters.backend.modules.board.application.JoinRequestCommand;
import com.fakebusters.backend.modules.board.application.JoinRequestService;
import com.fakebusters.backend.modules.board.application.event.BoardEvent;
import com.fakebusters.backend.modules.board.application.event.BoardEventBus;
import com.fakebusters.backend.modules.board.application.event.BoardEventPublisher;
import com.fakebusters.backend.modules.board.application.event.BoardEventType;
import com.fakebusters.backend.modules.board.application.event.InProcessBoardEventBus;
import com.fakebusters.backend.modules.board.domain.Board;
import com.fakebusters.backend.modules.board.domain.BoardMember;
import com.fakebusters.backend.modules.board.domain.BoardRole;
import com.fakebusters.backend.modules.board.domain.JoinRequest;
import com.fakebusters.backend.modules.board.infrastructure.persistence.BoardMemberRepository;
import com.fakebusters.backend.modules.board.infrastructure.persistence.BoardRepository;
import com.fakebusters.backend.modules.board.infrastructure.persistence.JoinRequestRepository;
import com.fakebusters.backend.support.AbstractPostgresIntegrationTest;
import com.fakebusters.backend.support.TestUserFactory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the services against PostgreSQL with every call committing its own transaction, so rollbacks and
 * after-commit notifications behave as in production.
 */
@DataJpaTest(properties = {
        "spring.jpa.hibernate.ddl-auto=validate"
})
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
@ImportAutoConfiguration(ValidationAutoConfiguration.class)
@Import({
        JpaConfig.class,
        TimeConfig.class,
        CommandValidator.class,
        InProcessBoardEventBus.class,
        BoardEventPublisher.class,
        AuditLogService.class,
        BoardMemberService.class,
        BoardService.class,
        JoinRequestService.class,
        TestUserFactory.class
})
class BoardIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final BoardAttributes VALID_ATTRIBUTES = new BoardAttributes("d", "f", 1, "r", 0, 0);

    @Autowired
    private BoardService boardService;

    @Autowired
    private BoardMemberService boardMemberService;

    @Autowired
    private JoinRequestService joinRequestService;

    @Autowired
    private BoardEventBus boardEventBus;

    @Autowired
    private BoardRepository boardRepository;

    @Autowired
    private BoardMemberRepository boardMemberRepository;

    @Autowired
    private JoinRequestRepository joinRequestRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    private final List<BoardEvent> events = new ArrayList<>();
    private BoardEventBus.Subscription subscription;

    private UserAccount judge;
    private UserAccount requester;

    @BeforeEach
    void setUp() {
        subscription = boardEventBus.subscribe(events::add);
        judge = testUserFactory.createUser();
        requester = testUserFactory.createUser();
    }

    @AfterEach
    void tearDown() {
        subscription.cancel();
    }

    @Test
    @DisplayName("판사와 함께 만든 보드는 보드 1건, 판사 멤버십 1건, board_created 이벤트 1건을 남긴다")
    void createBoardWithJudge_persistsBoardAndJudge() {
        Board board = boardService.createBoardWithJudge(VALID_ATTRIBUTES, judge.getId());

        assertThat(boardRepository.findById(board.getId())).isPresent();
        assertThat(boardService.countMembers(board.getId())).isEqualTo(1L);
        assertThat(boardService.findRole(board.getId(), judge.getId())).contains(BoardRole.JUDGE);
        assertThat(boardService.findJudge(board.getId()))
                .hasValueSatisfying(user -> assertThat(user.getId()).isEqualTo(judge.getId()));
        assertThat(boardService.isMember(board.getId(), judge.getId())).isTrue();

        assertThat(events).hasSize(1);
        assertThat(events.get(0).type()).isEqualTo(BoardEventType.BOARD_CREATED);
        assertThat(events.get(0).board().id()).isEqualTo(board.getId());
        assertThat(events.get(0).board().createdAt()).isNotNull();
    }

    @Test
    @DisplayName("판사 멤버십 생성이 실패하면 보드도 남지 않는다")
    void createBoardWithJudge_rollsBackBoardWhenJudgeMissing() {
        UUID unknownUser = UUID.randomUUID();

        assertThatThrownBy(() -> boardService.createBoardWithJudge(VALID_ATTRIBUTES, unknownUser))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND"));

        assertThat(boardRepository.count()).isZero();
        assertThat(boardMemberRepository.count()).isZero();
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("필수 속성이 빠진 보드는 저장되지 않고 이벤트도 없다")
    void createBoard_invalidAttributesPersistNothing() {
        assertThatThrownBy(() -> boardService.createBoard(new BoardAttributes(null, null, null, null, null, null)))
                .isInstanceOf(ValidationProblemException.class);

        assertThat(boardService.listBoards()).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("가입 요청을 승인하면 요청은 사라지고 요청자가 멤버가 된다")
    void approve_turnsRequestIntoMembership() {
        Board board = boardService.createBoardWithJudge(VALID_ATTRIBUTES, judge.getId());
        JoinRequest request = joinRequestService.createJoinRequest(
                new JoinRequestCommand("please", BoardRole.JUROR, requester.getId(), board.getId()));
        assertThat(joinRequestService.alreadyRequested(requester.getId(), board.getId())).isTrue();

        BoardMember member = joinRequestService.approve(
                new ApproveJoinRequestCommand(requester.getId(), board.getId(), BoardRole.JUROR));

        assertThat(member.getId()).isNotNull();
        assertThat(joinRequestRepository.findById(request.getId())).isEmpty();
        assertThat(joinRequestService.alreadyRequested(requester.getId(), board.getId())).isFalse();
        assertThat(boardService.isMember(board.getId(), requester.getId())).isTrue();
        assertThat(boardService.findRole(board.getId(), requester.getId())).contains(BoardRole.JUROR);
        assertThat(boardService.countMembers(board.getId())).isEqualTo(2L);

        List<AuditLog> trail = auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc(
                AuditLogService.RESOURCE_JOIN_REQUEST, request.getId().toString());
        assertThat(trail).extracting(AuditLog::getActionType)
                .containsExactly(AuditLogService.ACTION_JOIN_REQUEST_APPROVED);
    }

    @Test
    @DisplayName("대기 중인 요청이 없는 승인은 실패하고 멤버를 만들지 않는다")
    void approve_withoutPendingRequestChangesNothing() {
        Board board = boardService.createBoardWithJudge(VALID_ATTRIBUTES, judge.getId());

        assertThatThrownBy(() -> joinRequestService.approve(
                new ApproveJoinRequestCommand(requester.getId(), board.getId(), BoardRole.JUROR)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("JOIN_REQUEST_NOT_FOUND"));

        assertThat(boardService.isMember(board.getId(), requester.getId())).isFalse();
        assertThat(boardService.countMembers(board.getId())).isEqualTo(1L);
    }

    @Test
    @DisplayName("판사 자리로 승인하려다 실패하면 요청이 그대로 남는다")
    void approve_rollsBackWhenMembershipRejected() {
        Board board = boardService.createBoardWithJudge(VALID_ATTRIBUTES, judge.getId());
        JoinRequest request = joinRequestService.createJoinRequest(
                new JoinRequestCommand("let me judge", BoardRole.JUDGE, requester.getId(), board.getId()));

        assertThatThrownBy(() -> joinRequestService.approve(
                new ApproveJoinRequestCommand(requester.getId(), board.getId(), null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("JUDGE_ALREADY_ASSIGNED"));

        assertThat(joinRequestRepository.findById(request.getId())).isPresent();
        assertThat(boardService.isMember(board.getId(), requester.getId())).isFalse();
    }

    @Test
    @DisplayName("철회된 요청은 멤버십 없이 삭제되고 철회 기록이 남는다")
    void withdraw_deletesRequestWithoutMembership() {
        Board board = boardService.createBoardWithJudge(VALID_ATTRIBUTES, judge.getId());
        JoinRequest request = joinRequestService.createJoinRequest(
                new JoinRequestCommand("please", BoardRole.AUDIENCE, requester.getId(), board.getId()));

        joinRequestService.deleteJoinRequest(request.getId());

        assertThat(joinRequestService.listForBoard(board.getId())).isEmpty();
        assertThat(boardService.isMember(board.getId(), requester.getId())).isFalse();
        assertThat(auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc(
                AuditLogService.RESOURCE_JOIN_REQUEST, request.getId().toString()))
                .extracting(AuditLog::getActionType)
                .containsExactly(AuditLogService.ACTION_JOIN_REQUEST_WITHDRAWN);
    }

    @Test
    @DisplayName("보드 이벤트는 최신 가입 요청부터 나온다")
    void getBoardEvents_newestFirst() {
        Board board = boardService.createBoardWithJudge(VALID_ATTRIBUTES, judge.getId());
        UserAccount later = testUserFactory.createUser();
        joinRequestService.createJoinRequest(
                new JoinRequestCommand("first", BoardRole.JUROR, requester.getId(), board.getId()));
        joinRequestService.createJoinRequest(
                new JoinRequestCommand("second", BoardRole.AUDIENCE, later.getId(), board.getId()));

        assertThat(boardService.getBoardEvents(board.getId()))
                .extracting(JoinRequest::getMotivation)
                .containsExactly("second", "first");
    }

    @Test
    @DisplayName("보드 이벤트와 보드별 요청 목록은 트랜잭션 밖에서도 요청자 정보를 읽을 수 있다")
    void boardRequests_loadUserAndBoard() {
        Board board = boardService.createBoardWithJudge(VALID_ATTRIBUTES, judge.getId());
        joinRequestService.createJoinRequest(
                new JoinRequestCommand("please", BoardRole.JUROR, requester.getId(), board.getId()));

        assertThat(boardService.getBoardEvents(board.getId()))
                .singleElement()
                .satisfies(request -> {
                    assertThat(request.getUser().getLoginId()).isEqualTo(requester.getLoginId());
                    assertThat(request.getBoard().getFact()).isEqualTo("f");
                });
        assertThat(joinRequestService.listForBoard(board.getId()))
                .extracting(request -> request.getUser().getDisplayName())
                .containsExactly(requester.getDisplayName());
    }

    @Test
    @DisplayName("수정과 삭제는 각각 board_updated, board_deleted 이벤트를 한 번씩 발행한다")
    void updateAndDelete_publishOneEventEach() {
        Board board = boardService.createBoard(VALID_ATTRIBUTES);
        joinRequestService.createJoinRequest(
                new JoinRequestCommand("please", BoardRole.JUROR, requester.getId(), board.getId()));
        events.clear();

        Board updated = boardService.updateBoard(board.getId(), new BoardPatch(null, null, 2, null, 3, null));
        assertThat(updated.getPhase()).isEqualTo(2);
        assertThat(boardService.getBoard(board.getId()).getVerdictFalsy()).isEqualTo(3);

        boardService.deleteBoard(board.getId());

        assertThat(boardService.findBoard(board.getId())).isEmpty();
        assertThat(joinRequestService.listJoinRequests()).isEmpty();
        assertThat(events).extracting(BoardEvent::type)
                .containsExactly(BoardEventType.BOARD_UPDATED, BoardEventType.BOARD_DELETED);
        assertThat(events.get(1).board().phase()).isEqualTo(2);
    }

    @Test
    @DisplayName("보드를 삭제하면 멤버십도 함께 삭제된다")
    void deleteBoard_cascadesMemberships() {
        Board board = boardService.createBoardWithJudge(VALID_ATTRIBUTES, judge.getId());

        boardService.deleteBoard(board.getId());

        assertThat(boardMemberService.listMembers()).isEmpty();
        assertThat(boardService.findJudge(board.getId())).isEmpty();
    }
}
