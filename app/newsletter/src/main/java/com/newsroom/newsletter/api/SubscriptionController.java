/*
 * どこで: Newsletter API
 * 何を: 購読登録と、メール内リンクからの購読確認/解除のエンドポイントを提供する
 * なぜ: 読者向けの公開インターフェースを管理者 API と分けるため
 */
package com.newsroom.newsletter.api;

import com.newsroom.newsletter.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

  private static final String PARAM_TOKEN = "subscription_token";

  private final SubscriptionService subscriptionService;

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public SubscribeResponse subscribe(@RequestBody SubscribeRequest request) {
    return subscriptionService.subscribe(request);
  }

  // HTML フォームからの登録
  @PostMapping(consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public SubscribeResponse subscribeForm(
      @RequestParam(value = "email", required = false) String email,
      @RequestParam(value = "name", required = false) String name) {
    return subscriptionService.subscribe(new SubscribeRequest(email, name));
  }

  @GetMapping("/confirm")
  public ConfirmSubscriptionResponse confirm(
      @RequestParam(value = PARAM_TOKEN, required = false) String token) {
    return subscriptionService.confirm(token);
  }

  @GetMapping("/unsubscribe")
  public UnsubscribeResponse unsubscribe(
      @RequestParam(value = PARAM_TOKEN, required = false) String token) {
    return subscriptionService.unsubscribe(token);
  }
}
