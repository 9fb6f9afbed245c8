package io.netloom.topology.resolved;

public record InternalVlan(int id, String parent, String name, String ip, String gateway) {

    public static String nameOf(String parent, int id) {
        return parent + "." + id;
    }
}
