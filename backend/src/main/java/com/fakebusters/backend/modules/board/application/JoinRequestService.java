package com.fakebusters.backend.modules.board.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fakebusters.backend.global.error.CommandValidator;
import com.fakebusters.backend.global.error.ProblemException;
import com.fakebusters.backend.modules.audit.application.AuditLogService;
import com.fakebusters.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fakebusters.backend.modules.auth.domain.UserAccount;
import com.fakebusters.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.fakebusters.backend.modules.board.domain.Board;
import com.fakebusters.backend.modules.board.domain.BoardMember;
import com.fakebusters.backend.modules.board.domain.BoardRole;
import com.fakebusters.backend.modules.board.domain.JoinRequest;
import com.fakebusters.backend.modules.board.infrastructure.persistence.BoardMemberRepository;
import com.fakebusters.backend.modules.board.infrastructure.persistence.BoardRepository;
import com.fakebusters.backend.modules.board.infrastructure.persistence.JoinRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Pending join requests and their approval.
 *
 * <p>A request ends either approved, when {@link #approve} turns it into a membership, or withdrawn, when
 * {@link #deleteJoinRequest} removes it. Both outcomes delete the row and leave an audit entry.
 */
@Service
@Transactional
public class JoinRequestService {

    private static final Logger log = LoggerFactory.getLogger(JoinRequestService.class);

    private final JoinRequestRepository joinRequestRepository;
    private final BoardMemberRepository boardMemberRepository;
    private final BoardRepository boardRepository;
    private final UserAccountRepository userAccountRepository;
    private final BoardMemberService boardMemberService;
    private final AuditLogService auditLogService;
    private final CommandValidator commandValidator;

    public JoinRequestService(
            JoinRequestRepository joinRequestRepository,
            BoardMemberRepository boardMemberRepository,
            BoardRepository boardRepository,
            UserAccountRepository userAccountRepository,
            BoardMemberService boardMemberService,
            AuditLogService auditLogService,
            CommandValidator commandValidator
    ) {
        this.joinRequestRepository = joinRequestRepository;
        this.boardMemberRepository = boardMemberRepository;
        this.boardRepository = boardRepository;
        this.userAccountRepository = userAccountRepository;
        this.boardMemberService = boardMemberService;
        this.auditLogService = auditLogService;
        this.commandValidator = commandValidator;
    }

    @Transactional(readOnly = true)
    public List<JoinRequest> listJoinRequests() {
        return joinRequestRepository.findAll();
    }

    @Transactional(readOnly = true)
    public JoinRequest getJoinRequest(UUID joinRequestId) {
        return joinRequestRepository.findById(joinRequestId)
                .orElseThrow(() -> ProblemException.notFound("JOIN_REQUEST_NOT_FOUND", joinRequestId));
    }

    @Transactional(readOnly = true)
    public boolean alreadyRequested(UUID userId, UUID boardId) {
        return joinRequestRepository.existsByBoardIdAndUserId(boardId, userId);
    }

    @Transactional(readOnly = true)
    public List<JoinRequest> listForBoard(UUID boardId) {
        return joinRequestRepository.findByBoardId(boardId);
    }

    public JoinRequest createJoinRequest(JoinRequestCommand command) {
        commandValidator.requireValid(command);

        Board board = command.boardId() != null ? requireBoard(command.boardId()) : null;
        UserAccount user = command.userId() != null ? requireUser(command.userId()) : null;

        if (board != null && user != null) {
            if (joinRequestRepository.existsByBoardIdAndUserId(board.getId(), user.getId())) {
                throw ProblemException.conflict("JOIN_REQUEST_DUPLICATED",
                        "user " + user.getId() + " already asked to join board " + board.getId());
            }
            if (boardMemberRepository.existsByBoardIdAndUserId(board.getId(), user.getId())) {
                throw ProblemException.conflict("ALREADY_MEMBER",
                        "user " + user.getId() + " is already a member of board " + board.getId());
            }
        }

        JoinRequest request = new JoinRequest();
        request.setMotivation(command.motivation());
        request.setPreferredRole(command.preferredRole());
        request.setBoard(board);
        request.setUser(user);
        return joinRequestRepository.save(request);
    }

    public JoinRequest updateJoinRequest(UUID joinRequestId, JoinRequestPatch patch) {
        JoinRequest request = getJoinRequest(joinRequestId);
        JoinRequestCommand merged = commandValidator.requireValid(
                patch != null ? patch.mergeWith(request) : null);
        request.setMotivation(merged.motivation());
        request.setPreferredRole(merged.preferredRole());
        return joinRequestRepository.saveAndFlush(request);
    }

    /**
     * Withdraws a pending request. No membership is created.
     */
    public void deleteJoinRequest(UUID joinRequestId) {
        JoinRequest request = getJoinRequest(joinRequestId);
        joinRequestRepository.delete(request);
        UUID userId = request.getUser() != null ? request.getUser().getId() : null;
        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_JOIN_REQUEST_WITHDRAWN,
                AuditLogService.RESOURCE_JOIN_REQUEST,
                joinRequestId.toString(),
                userId,
                describe(request, null)
        ));
        log.info("Join request {} withdrawn", joinRequestId);
    }

    /**
     * Turns the pending request of {@code (userId, boardId)} into a membership.
     *
     * <p>The membership insert and the request delete share one transaction. Unless exactly one pending
     * request is removed the whole operation rolls back and no membership remains.
     */
    public BoardMember approve(ApproveJoinRequestCommand command) {
        commandValidator.requireValid(command);

        JoinRequest request = joinRequestRepository.findByBoardIdAndUserId(command.boardId(), command.userId())
                .orElseThrow(() -> pendingRequestMissing(command));

        BoardRole role = command.role() != null ? command.role() : request.getPreferredRole();
        BoardMember member = boardMemberService.createMember(
                new BoardMemberCommand(role, command.userId(), command.boardId()));

        int deleted = joinRequestRepository.deletePendingById(request.getId());
        if (deleted != 1) {
            // another approval or a withdrawal consumed the request concurrently
            throw pendingRequestMissing(command);
        }

        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_JOIN_REQUEST_APPROVED,
                AuditLogService.RESOURCE_JOIN_REQUEST,
                request.getId().toString(),
                null,
                describe(request, role)
        ));
        log.info("Join request {} approved: user {} joined board {} as {}",
                request.getId(), command.userId(), command.boardId(), role);
        return member;
    }

    private ProblemException pendingRequestMissing(ApproveJoinRequestCommand command) {
        return ProblemException.conflict("JOIN_REQUEST_NOT_FOUND",
                "no pending join request of user " + command.userId() + " for board " + command.boardId());
    }

    private Map<String, Object> describe(JoinRequest request, BoardRole grantedRole) {
        Map<String, Object> detail = new LinkedHashMap<>();
        if (request.getBoard() != null) {
            detail.put("boardId", request.getBoard().getId().toString());
        }
        if (request.getUser() != null) {
            detail.put("userId", request.getUser().getId().toString());
        }
        detail.put("preferredRole", request.getPreferredRole().name());
        if (grantedRole != null) {
            detail.put("grantedRole", grantedRole.name());
        }
        return detail;
    }

    private Board requireBoard(UUID boardId) {
        return boardRepository.findById(boardId)
                .orElseThrow(() -> ProblemException.notFound("BOARD_NOT_FOUND", boardId));
    }

    private UserAccount requireUser(UUID userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", userId));
    }
}
