package app.tiered.entitlement.subscriber;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class SubscriberRegistry {

    private final Map<String, SubscriberResolver> resolvers;

    @Autowired
    public SubscriberRegistry(ObjectProvider<SubscriberResolver> provider) {
        this(provider.orderedStream().toList());
    }

    public SubscriberRegistry(List<SubscriberResolver> list) {
        Map<String, SubscriberResolver> map = new HashMap<>();
        for (var r : list) {
            var previous = map.put(r.type(), r);
            if (previous != null) {
                throw new IllegalStateException("Duplicate subscriber resolver for type: " + r.type());
            }
        }
        this.resolvers = Map.copyOf(map);
    }

    public boolean supports(String type) {
        return resolvers.containsKey(type);
    }

    public Set<String> types() {
        return resolvers.keySet();
    }

    public Optional<Subscribable> resolve(SubscriberRef ref) {
        var resolver = resolvers.get(ref.type());
        if (resolver == null) throw new IllegalArgumentException("Unsupported subscriber type: " + ref.type());
        return resolver.resolve(ref.id()).map(Subscribable.class::cast);
    }
}
