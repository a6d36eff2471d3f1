package io.github.eventfold.core.example.account;

/*-
 * #%L
 * eventfold
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class AccountState {
    private final String owner;
    private final long balance;
    private final boolean closed;

    @JsonCreator
    public AccountState(@JsonProperty("owner") String owner, @JsonProperty("balance") long balance,
            @JsonProperty("closed") boolean closed) {
        this.owner = owner;
        this.balance = balance;
        this.closed = closed;
    }

    public String getOwner() {
        return owner;
    }

    public long getBalance() {
        return balance;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccountState)) {
            return false;
        }
        AccountState that = (AccountState) o;
        return balance == that.balance && closed == that.closed && Objects.equals(owner, that.owner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, balance, closed);
    }

    @Override
    public String toString() {
        return "AccountState{" + "owner='" + owner + '\'' + ", balance=" + balance + ", closed=" + closed + '}';
    }
}
