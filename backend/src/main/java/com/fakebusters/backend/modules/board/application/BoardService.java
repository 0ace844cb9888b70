package com.fakebusters.backend.modules.board.application;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fakebusters.backend.global.error.CommandValidator;
import com.fakebusters.backend.global.error.ProblemException;
import com.fakebusters.backend.global.error.ValidationProblemException;
import com.fakebusters.backend.modules.audit.application.AuditLogService;
import com.fakebusters.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fakebusters.backend.modules.auth.domain.UserAccount;
import com.fakebusters.backend.modules.board.application.event.BoardEventPublisher;
import com.fakebusters.backend.modules.board.application.event.BoardEventType;
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
 * Board lifecycle and the membership queries used for authorization.
 *
 * <p>Every successful create, update or delete publishes exactly one {@link BoardEventType} event once the
 * transaction has committed.
 */
@Service
@Transactional
public class BoardService {

    private static final Logger log = LoggerFactory.getLogger(BoardService.class);

    private final BoardRepository boardRepository;
    private final BoardMemberRepository boardMemberRepository;
    private final JoinRequestRepository joinRequestRepository;
    private final BoardMemberService boardMemberService;
    private final AuditLogService auditLogService;
    private final BoardEventPublisher boardEventPublisher;
    private final CommandValidator commandValidator;

    public BoardService(
            BoardRepository boardRepository,
            BoardMemberRepository boardMemberRepository,
            JoinRequestRepository joinRequestRepository,
            BoardMemberService boardMemberService,
            AuditLogService auditLogService,
            BoardEventPublisher boardEventPublisher,
            CommandValidator commandValidator
    ) {
        this.boardRepository = boardRepository;
        this.boardMemberRepository = boardMemberRepository;
        this.joinRequestRepository = joinRequestRepository;
        this.boardMemberService = boardMemberService;
        this.auditLogService = auditLogService;
        this.boardEventPublisher = boardEventPublisher;
        this.commandValidator = commandValidator;
    }

    @Transactional(readOnly = true)
    public List<Board> listBoards() {
        return boardRepository.findAll();
    }

    @Transactional(readOnly = true)
    public Board getBoard(UUID boardId) {
        return boardRepository.findById(boardId)
                .orElseThrow(() -> ProblemException.notFound("BOARD_NOT_FOUND", boardId));
    }

    @Transactional(readOnly = true)
    public Optional<Board> findBoard(UUID boardId) {
        return boardRepository.findById(boardId);
    }

    public Board createBoard(BoardAttributes attributes) {
        Board board = insertBoard(attributes);
        log.info("Board {} created", board.getId());
        boardEventPublisher.publishAfterCommit(BoardEventType.BOARD_CREATED, board);
        return board;
    }

    /**
     * Creates the board and makes {@code judgeUserId} its judge in one transaction. If either insert fails
     * neither row is kept and no event is published.
     */
    public Board createBoardWithJudge(BoardAttributes attributes, UUID judgeUserId) {
        if (judgeUserId == null) {
            throw new ValidationProblemException(Map.of("judgeUserId", "must not be null"));
        }
        Board board = insertBoard(attributes);
        boardMemberService.createMember(new BoardMemberCommand(BoardRole.JUDGE, judgeUserId, board.getId()));
        log.info("Board {} created with judge {}", board.getId(), judgeUserId);
        boardEventPublisher.publishAfterCommit(BoardEventType.BOARD_CREATED, board);
        return board;
    }

    public Board updateBoard(UUID boardId, BoardPatch patch) {
        Board board = getBoard(boardId);
        BoardAttributes merged = commandValidator.requireValid(
                patch != null ? patch.mergeWith(board) : null);
        merged.applyTo(board);
        Board saved = boardRepository.saveAndFlush(board);
        boardEventPublisher.publishAfterCommit(BoardEventType.BOARD_UPDATED, saved);
        return saved;
    }

    /**
     * Deletes the board together with its memberships and pending join requests.
     */
    public void deleteBoard(UUID boardId) {
        Board board = getBoard(boardId);
        int removedRequests = joinRequestRepository.deleteAllByBoardId(boardId);
        int removedMembers = boardMemberRepository.deleteAllByBoardId(boardId);
        boardRepository.delete(board);
        boardRepository.flush();

        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_BOARD_DELETED,
                AuditLogService.RESOURCE_BOARD,
                boardId.toString(),
                null,
                Map.of("removedMembers", removedMembers, "removedJoinRequests", removedRequests)
        ));
        log.info("Board {} deleted with {} member(s) and {} join request(s)", boardId, removedMembers, removedRequests);
        boardEventPublisher.publishAfterCommit(BoardEventType.BOARD_DELETED, board);
    }

    @Transactional(readOnly = true)
    public long countMembers(UUID boardId) {
        return boardMemberRepository.countByBoardId(boardId);
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> findJudge(UUID boardId) {
        return boardMemberRepository.findUserByBoardIdAndRole(boardId, BoardRole.JUDGE);
    }

    @Transactional(readOnly = true)
    public boolean isMember(UUID boardId, UUID userId) {
        return boardMemberRepository.existsByBoardIdAndUserId(boardId, userId);
    }

    @Transactional(readOnly = true)
    public Optional<BoardRole> findRole(UUID boardId, UUID userId) {
        return boardMemberRepository.findByBoardIdAndUserId(boardId, userId)
                .map(BoardMember::getRole);
    }

    /**
     * Activity feed of a board, newest first. Join requests are currently the only kind of entry; their
     * user and board are fetched with them.
     */
    @Transactional(readOnly = true)
    public List<JoinRequest> getBoardEvents(UUID boardId) {
        return joinRequestRepository.findByBoardIdOrderByCreatedAtDesc(boardId);
    }

    private Board insertBoard(BoardAttributes attributes) {
        commandValidator.requireValid(attributes);
        Board board = new Board();
        attributes.applyTo(board);
        return boardRepository.save(board);
    }
}
