package io.b2mash.b2b.backing.order;

import io.b2mash.b2b.backing.member.CollectivePermissions;
import io.b2mash.b2b.backing.security.ActorContext;
import java.net.URI;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

  private final OrderPipeline orderPipeline;
  private final CapacityGuard capacityGuard;
  private final CollectivePermissions permissions;

  public OrderController(
      OrderPipeline orderPipeline,
      CapacityGuard capacityGuard,
      CollectivePermissions permissions) {
    this.orderPipeline = orderPipeline;
    this.capacityGuard = capacityGuard;
    this.permissions = permissions;
  }

  @PostMapping
  public ResponseEntity<OrderResponse> createOrder(@RequestBody OrderRequest request) {
    var actor = ActorContext.getCurrentActor();
    var result = orderPipeline.createOrder(actor, request);
    var stats = result.tier() != null ? capacityGuard.stats(result.tier()) : null;
    boolean showEmail =
        permissions.canSeeEmail(actor, result.createdBy().getId(), result.collective());
    return ResponseEntity.created(URI.create("/api/orders/" + result.order().getId()))
        .body(OrderResponse.of(result, stats, showEmail));
  }
}
