// public API (domain/port)
package com.causalloops.common.apiclient;

public interface ApiClient<In, Out> {
    Out post(String url, String corrId, In in);
}
