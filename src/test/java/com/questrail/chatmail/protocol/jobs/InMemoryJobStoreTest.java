package com.questrail.chatmail.protocol.jobs;

class InMemoryJobStoreTest extends AbstractJobStoreContractTest {

    @Override
    protected JobStore newStore() {
        return new InMemoryJobStore();
    }
}
