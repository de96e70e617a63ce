package com.krickert.testcontainers.speaches;

/**
 * {@link ServiceInstance} pointing at a {@link FakeSpeachesServer}; running state is switchable.
 */
class FakeServiceInstance implements ServiceInstance {

    private final String label;
    private final FakeSpeachesServer server;
    private volatile boolean running = true;

    FakeServiceInstance(String label, FakeSpeachesServer server) {
        this.label = label;
        this.server = server;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public String getHost() {
        return server.getHost();
    }

    @Override
    public int getPort() {
        return server.getPort();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void stop() {
        running = false;
    }
}
