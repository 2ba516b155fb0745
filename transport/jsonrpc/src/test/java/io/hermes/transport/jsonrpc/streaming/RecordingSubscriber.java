package io.hermes.transport.jsonrpc.streaming;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Flow;

class RecordingSubscriber implements Flow.Subscriber<String> {

    final List<String> items = new CopyOnWriteArrayList<>();
    final long initialRequest;
    volatile Flow.Subscription subscription;
    volatile boolean completed;
    volatile Throwable failure;

    RecordingSubscriber(long initialRequest) {
        this.initialRequest = initialRequest;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (initialRequest > 0) {
            subscription.request(initialRequest);
        }
    }

    @Override
    public void onNext(String item) {
        items.add(item);
    }

    @Override
    public void onError(Throwable throwable) {
        failure = throwable;
    }

    @Override
    public void onComplete() {
        completed = true;
    }
}
