package com.fakebusters.backend.modules.board.application;

import java.util.List;
import java.util.UUID;

import com.fakebusters.backend.global.error.CommandValidator;
import com.fakebusters.backend.global.error.ProblemException;
import com.fakebusters.backend.modules.auth.domain.UserAccount;
import com.fakebusters.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.fakebusters.backend.modules.board.domain.Board;
import com.fakebusters.backend.modules.board.domain.BoardMember;
import com.fakebusters.backend.modules.board.domain.BoardRole;
import com.fakebusters.backend.modules.board.infrastructure.persistence.BoardMemberRepository;
import com.fakebusters.backend.modules.board.infrastructure.persistence.BoardRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class BoardMemberService {

    private final BoardMemberRepository boardMemberRepository;
    private final BoardRepository boardRepository;
    private final UserAccountRepository userAccountRepository;
    private final CommandValidator commandValidator;

    public BoardMemberService(
            BoardMemberRepository boardMemberRepository,
            BoardRepository boardRepository,
            UserAccountRepository userAccountRepository,
            CommandValidator commandValidator
    ) {
        this.boardMemberRepository = boardMemberRepository;
        this.boardRepository = boardRepository;
        this.userAccountRepository = userAccountRepository;
        this.commandValidator = commandValidator;
    }

    @Transactional(readOnly = true)
    public List<BoardMember> listMembers() {
        return boardMemberRepository.findAll();
    }

    @Transactional(readOnly = true)
    public BoardMember getMember(UUID memberId) {
        return boardMemberRepository.findById(memberId)
                .orElseThrow(() -> ProblemException.notFound("BOARD_MEMBER_NOT_FOUND", memberId));
    }

    public BoardMember createMember(BoardMemberCommand command) {
        commandValidator.requireValid(command);

        Board board = command.boardId() != null ? requireBoard(command.boardId()) : null;
        UserAccount user = command.userId() != null ? requireUser(command.userId()) : null;

        if (board != null && user != null
                && boardMemberRepository.existsByBoardIdAndUserId(board.getId(), user.getId())) {
            throw ProblemException.conflict("ALREADY_MEMBER",
                    "user " + user.getId() + " is already a member of board " + board.getId());
        }
        if (board != null && command.role().isJudge()) {
            ensureNoJudge(board.getId());
        }

        BoardMember member = new BoardMember();
        member.setRole(command.role());
        member.setBoard(board);
        member.setUser(user);
        return boardMemberRepository.saveAndFlush(member);
    }

    /**
     * Only the role is mutable; user and board of an existing membership never change.
     */
    public BoardMember updateMember(UUID memberId, BoardMemberCommand command) {
        commandValidator.requireValid(command);
        BoardMember member = getMember(memberId);

        BoardRole role = command.role();
        Board board = member.getBoard();
        if (board != null && role.isJudge() && member.getRole() != BoardRole.JUDGE) {
            ensureNoJudge(board.getId());
        }
        member.setRole(role);
        return boardMemberRepository.saveAndFlush(member);
    }

    public void deleteMember(UUID memberId) {
        BoardMember member = getMember(memberId);
        boardMemberRepository.delete(member);
    }

    private void ensureNoJudge(UUID boardId) {
        if (boardMemberRepository.existsByBoardIdAndRole(boardId, BoardRole.JUDGE)) {
            throw ProblemException.conflict("JUDGE_ALREADY_ASSIGNED", "board " + boardId + " already has a judge");
        }
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
