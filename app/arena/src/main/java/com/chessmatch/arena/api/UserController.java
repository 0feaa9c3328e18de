package com.chessmatch.arena.api;

import com.chessmatch.arena.api.response.UserResponse;
import com.chessmatch.arena.model.PageSpec;
import com.chessmatch.arena.model.UserFilter;
import com.chessmatch.arena.repository.query.QueryColumn;
import com.chessmatch.arena.repository.query.UserColumn;
import com.chessmatch.arena.service.UserService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
@Validated
public class UserController {

  private final UserService userService;

  @GetMapping
  public List<UserResponse> list(
      @RequestParam(value = "user_id", required = false) Long userId,
      @RequestParam(value = "user_name", required = false) String userName,
      @RequestParam(value = "deleted", required = false) Boolean deleted,
      @RequestParam(value = "order_by", defaultValue = "date_joined") String orderBy,
      @RequestParam(value = "reverse", defaultValue = "false") boolean reverse,
      @RequestParam(value = "skip", defaultValue = "0") @Min(0) int skip,
      @RequestParam(value = "limit", defaultValue = "10") @Min(1) @Max(PageSpec.MAX_LIMIT)
          int limit) {
    final UserColumn column =
        QueryColumn.fromApiName(UserColumn.class, orderBy)
            .orElseThrow(
                () -> new InvalidRequestException("cannot order users by '" + orderBy + "'"));
    return userService
        .list(new UserFilter(userId, userName, deleted), column, new PageSpec(skip, limit, reverse))
        .stream()
        .map(UserResponse::publicView)
        .toList();
  }

  @GetMapping("/self")
  public UserResponse self(Authentication authentication) {
    return UserResponse.selfView(userService.get(AuthenticatedUser.id(authentication)));
  }

  @DeleteMapping("/self")
  public ResponseEntity<Void> deleteSelf(Authentication authentication) {
    userService.softDelete(AuthenticatedUser.id(authentication));
    return ResponseEntity.noContent().build();
  }
}
