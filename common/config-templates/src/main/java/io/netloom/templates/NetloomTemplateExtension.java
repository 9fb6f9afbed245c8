package io.netloom.templates;

import com.mitchellbosecke.pebble.error.PebbleException;
import com.mitchellbosecke.pebble.extension.AbstractExtension;
import com.mitchellbosecke.pebble.extension.Filter;
import com.mitchellbosecke.pebble.extension.Function;
import com.mitchellbosecke.pebble.template.EvaluationContext;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import io.netloom.topology.model.Ipv4;
import java.util.List;
import java.util.Map;

/**
 * Address helpers available to every template.
 * <ul>
 *   <li>{@code cidr | address}, {@code cidr | prefixlen}, {@code cidr | network}, {@code cidr | netmask}</li>
 *   <li>{@code value | sysctl} renders booleans as {@code 1}/{@code 0}</li>
 *   <li>{@code inSubnet(cidr, address)}</li>
 * </ul>
 */
final class NetloomTemplateExtension extends AbstractExtension {

    @Override
    public Map<String, Filter> getFilters() {
        return Map.of(
            "address", new CidrFilter("address") {
                @Override
                Object convert(String cidr) {
                    return Ipv4.address(cidr);
                }
            },
            "prefixlen", new CidrFilter("prefixlen") {
                @Override
                Object convert(String cidr) {
                    return Ipv4.prefixLength(cidr);
                }
            },
            "network", new CidrFilter("network") {
                @Override
                Object convert(String cidr) {
                    return Ipv4.network(cidr);
                }
            },
            "netmask", new CidrFilter("netmask") {
                @Override
                Object convert(String cidr) {
                    return Ipv4.netmask(cidr);
                }
            },
            "sysctl", new SysctlValueFilter()
        );
    }

    @Override
    public Map<String, Function> getFunctions() {
        return Map.of("inSubnet", new InSubnetFunction());
    }

    private abstract static class CidrFilter implements Filter {

        private final String name;

        CidrFilter(String name) {
            this.name = name;
        }

        abstract Object convert(String cidr);

        @Override
        public List<String> getArgumentNames() {
            return null;
        }

        @Override
        public Object apply(Object input,
                            Map<String, Object> args,
                            PebbleTemplate self,
                            EvaluationContext context,
                            int lineNumber) throws PebbleException {
            if (input == null) {
                return null;
            }
            String text = input.toString();
            if (!Ipv4.isCidr(text)) {
                throw new PebbleException(null, name + " filter expects an IPv4 CIDR, got '" + text + "'",
                    lineNumber, self.getName());
            }
            return convert(text);
        }
    }

    private static final class SysctlValueFilter implements Filter {

        @Override
        public List<String> getArgumentNames() {
            return null;
        }

        @Override
        public Object apply(Object input,
                            Map<String, Object> args,
                            PebbleTemplate self,
                            EvaluationContext context,
                            int lineNumber) {
            if (input instanceof Boolean flag) {
                return flag ? "1" : "0";
            }
            return input == null ? "" : input.toString();
        }
    }

    private static final class InSubnetFunction implements Function {

        @Override
        public List<String> getArgumentNames() {
            return List.of("cidr", "address");
        }

        @Override
        public Object execute(Map<String, Object> args,
                              PebbleTemplate self,
                              EvaluationContext context,
                              int lineNumber) {
            Object cidr = args.get("cidr");
            Object address = args.get("address");
            if (cidr == null || address == null) {
                return false;
            }
            return Ipv4.contains(cidr.toString(), address.toString());
        }
    }
}
