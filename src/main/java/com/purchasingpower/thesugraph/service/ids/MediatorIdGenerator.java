package com.purchasingpower.thesugraph.service.ids;

import com.google.common.base.Preconditions;
import com.purchasingpower.thesugraph.model.ids.EmittedIds;
import com.purchasingpower.thesugraph.model.ids.IdSeed;
import com.purchasingpower.thesugraph.model.ids.MediatorId;
import com.purchasingpower.thesugraph.model.ids.RelationRole;
import org.springframework.stereotype.Component;

/**
 * Allocates mediator node ids that do not collide with anything already emitted.
 *
 * <p>The result depends only on the arguments and on the {@link EmittedIds} snapshot, so the
 * same filtered input always yields the same ids.
 */
@Component
public class MediatorIdGenerator {

    private static final int MAX_ATTEMPTS = 100_000;

    public MediatorId allocate(EmittedIds emitted, RelationRole role, String ownerId, String relatedId, IdSeed seed) {
        Preconditions.checkNotNull(emitted, "Emitted ids cannot be null");
        Preconditions.checkNotNull(role, "Role cannot be null");
        Preconditions.checkArgument(ownerId != null && !ownerId.isBlank(), "Owner id cannot be blank");
        Preconditions.checkArgument(relatedId != null && !relatedId.isBlank(), "Related id cannot be blank");
        Preconditions.checkNotNull(seed, "Seed cannot be null");

        String base = role.base(ownerId, relatedId);
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = base + "_" + seed.suffix(attempt);
            boolean taken = role.substringCollision() ? emitted.anyContains(candidate) : emitted.contains(candidate);
            if (!taken) {
                return new MediatorId(role, candidate);
            }
        }
        throw new IllegalStateException("No free mediator id for " + base + " after " + MAX_ATTEMPTS + " attempts");
    }
}
