package com.draupnir.policy.template;

import com.draupnir.policy.model.PolicyKind;
import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.model.document.SequenceNode;

import java.util.List;

/**
 * Builds a default-deny CiliumNetworkPolicy skeleton for one app.
 * <p>
 * Ingress admits the app's own endpoints on the given ports. Egress allows the given
 * FQDNs plus UDP/53 to kube-dns, which is always included.
 */
public class PolicyTemplateGenerator {

    public static final String API_VERSION = "cilium.io/v2";
    public static final List<String> DEFAULT_INGRESS_PORTS = List.of("80/TCP", "443/TCP");
    public static final List<String> DEFAULT_EGRESS_FQDNS = List.of("*.amazonaws.com");

    static final String NAMESPACE_LABEL = "k8s:io.kubernetes.pod.namespace";
    static final String DEFAULT_PROTOCOL = "TCP";

    /**
     * @param ingressPorts "port" or "port/protocol"; null or empty means 80/TCP and 443/TCP
     * @param egressFqdns  null or empty means *.amazonaws.com
     * @throws IllegalArgumentException for a blank app/namespace or a malformed port
     */
    public MappingNode generate(String app, String namespace, List<String> ingressPorts, List<String> egressFqdns) {
        if (app == null || app.isBlank()) {
            throw new IllegalArgumentException("app is required");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        List<String> ports = ingressPorts == null || ingressPorts.isEmpty() ? DEFAULT_INGRESS_PORTS : ingressPorts;
        List<String> fqdns = egressFqdns == null || egressFqdns.isEmpty() ? DEFAULT_EGRESS_FQDNS : egressFqdns;

        SequenceNode toPorts = SequenceNode.create();
        for (String port : ports) {
            toPorts.add(portRule(port));
        }

        MappingNode ingressRule = MappingNode.create()
                .put("fromEndpoints", SequenceNode.of(matchLabels(MappingNode.create().put("app", app))))
                .put("toPorts", toPorts);

        SequenceNode fqdnSelectors = SequenceNode.create();
        for (String fqdn : fqdns) {
            fqdnSelectors.add(MappingNode.create().put("matchName", fqdn));
        }

        MappingNode dnsRule = MappingNode.create()
                .put("toEndpoints", SequenceNode.of(matchLabels(MappingNode.create()
                        .put(NAMESPACE_LABEL, "kube-system")
                        .put("k8s-app", "kube-dns"))))
                .put("toPorts", SequenceNode.of(MappingNode.create()
                        .put("ports", SequenceNode.of(MappingNode.create()
                                .put("port", "53")
                                .put("protocol", "UDP")))));

        MappingNode spec = MappingNode.create()
                .put("endpointSelector", matchLabels(MappingNode.create()
                        .put(NAMESPACE_LABEL, namespace)
                        .put("app", app)))
                .put("ingress", SequenceNode.of(ingressRule))
                .put("egress", SequenceNode.of(
                        MappingNode.create().put("toFQDNs", fqdnSelectors),
                        dnsRule));

        return MappingNode.create()
                .put("apiVersion", API_VERSION)
                .put("kind", PolicyKind.CILIUM_NETWORK_POLICY.getKindName())
                .put("metadata", MappingNode.create()
                        .put("name", app + "-ztp")
                        .put("namespace", namespace))
                .put("spec", spec);
    }

    private static MappingNode matchLabels(MappingNode labels) {
        return MappingNode.create().put("matchLabels", labels);
    }

    /**
     * {@code 8080/TCP} becomes {@code {ports: [{port: "8080", protocol: TCP}]}}
     */
    static MappingNode portRule(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Port must not be null");
        }
        String[] parts = spec.split("/", -1);
        if (parts.length > 2 || parts[0].isBlank() || (parts.length == 2 && parts[1].isBlank())) {
            throw new IllegalArgumentException("Invalid port '" + spec + "', expected port or port/protocol");
        }
        String protocol = parts.length == 2 ? parts[1] : DEFAULT_PROTOCOL;
        return MappingNode.create()
                .put("ports", SequenceNode.of(MappingNode.create()
                        .put("port", parts[0])
                        .put("protocol", protocol)));
    }
}
